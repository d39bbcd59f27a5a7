/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import java.util.Random;

/**
 * Synthetic test seismograms: Gaussian windowed sine bursts and seeded white noise.
 */
public final class Synthetics {

  public static final long T0 = 1500000000000L;

  private Synthetics() {
  }

  /**
   * A sine burst with a Gaussian envelope.
   *
   * @param n Number of samples
   * @param dt Sample interval
   * @param center Time of the envelope peak in seconds after the first sample
   * @param freq Frequency of the sine in Hz
   * @param sigma Width of the envelope in seconds
   * @return the samples
   */
  public static double[] burst(int n, double dt, double center, double freq, double sigma) {
    double[] d = new double[n];
    for (int i = 0; i < n; i++) {
      double t = i * dt - center;
      d[i] = Math.sin(2. * Math.PI * freq * t) * Math.exp(-0.5 * t * t / (sigma * sigma));
    }
    return d;
  }

  public static double[] noise(int n, double amp, long seed) {
    Random r = new Random(seed);
    double[] d = new double[n];
    for (int i = 0; i < n; i++) {
      d[i] = amp * r.nextGaussian();
    }
    return d;
  }

  public static double[] add(double[] a, double[] b) {
    double[] d = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      d[i] = a[i] + b[i];
    }
    return d;
  }

  public static double[] negate(double[] a) {
    double[] d = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      d[i] = -a[i];
    }
    return d;
  }
}
