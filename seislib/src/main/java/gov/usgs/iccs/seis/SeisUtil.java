/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * Static time series operations on seismograms: index/time conversion, crop, pad, detrend, taper,
 * window, normalize and resample, plus a few array statistics used by the correlation code.
 * Operations which take a Seismogram change it in place.
 *
 * @author benz
 */
public final class SeisUtil {

  /** How a time that falls between samples is turned into an index */
  public enum Rounding {ROUND, FLOOR, CEIL}

  /** How data are extended past the ends of a seismogram */
  public enum PadMode {
    /** zeros */
    CONSTANT,
    /** a straight line from the edge sample to zero at the new end */
    LINEAR_RAMP
  }

  // half width in (output) samples of the resampling interpolation kernel
  private static final int RESAMPLE_LOBES = 8;

  private SeisUtil() {
  }

  /**
   * Return the data index corresponding to a time.
   *
   * @param s The seismogram
   * @param time The time in millis
   * @param method How to choose the index if the time is between samples, ROUND is to nearest
   * (half to even)
   * @param allowOutOfBounds If false, an index outside of the data throws
   * @return The index
   * @throws IllegalArgumentException if the index is out of bounds and that is not allowed
   */
  public static int time2index(Seismogram s, long time, Rounding method, boolean allowOutOfBounds) {
    double x = (time - s.getBeginTime()) / 1000. / s.getDelta();
    // remove the millisecond representation error before rounding
    double xr = Math.rint(x);
    if (Math.abs(x - xr) < 1.e-6) {
      x = xr;
    }
    double index;
    switch (method) {
      case CEIL:
        index = Math.ceil(x);
        break;
      case FLOOR:
        index = Math.floor(x);
        break;
      default:
        index = Math.rint(x);
        break;
    }
    if ((index >= 0 && index < s.getNsamp()) || allowOutOfBounds) {
      return (int) index;
    }
    throw new IllegalArgumentException("Invalid time provided, calculated index=" + (long) index
            + " is out of bounds nsamp=" + s.getNsamp());
  }

  public static int time2index(Seismogram s, long time) {
    return time2index(s, time, Rounding.ROUND, false);
  }

  /** Convert a sample offset to a millisecond offset */
  public static long samplesToMillis(double delta, long nsamp) {
    return Math.round(delta * nsamp * 1000.);
  }

  /**
   * Shorten a seismogram to the samples from begin to end inclusive.
   *
   * @param s The seismogram
   * @param begin New begin time, rounded to the nearest sample
   * @param end New end time, rounded to the nearest sample
   */
  public static void crop(Seismogram s, long begin, long end) {
    if (begin > end) {
      throw new IllegalArgumentException("New begin time cannot be after new end time");
    }
    int start = time2index(s, begin);
    int stop = time2index(s, end);
    double[] d = new double[stop - start + 1];
    System.arraycopy(s.getData(), start, d, 0, d.length);
    s.setData(d);
    s.setBeginTime(s.getBeginTime() + samplesToMillis(s.getDelta(), start));
  }

  /**
   * Extend a seismogram so that it covers begin to end. Nothing is done if it already does.
   *
   * @param s The seismogram
   * @param begin New begin time, rounded down to a sample
   * @param end New end time, rounded up to a sample
   * @param mode How to fill the new samples
   */
  public static void pad(Seismogram s, long begin, long end, PadMode mode) {
    if (begin > end) {
      throw new IllegalArgumentException("New begin time cannot be after new end time");
    }
    int start = time2index(s, begin, Rounding.FLOOR, true);
    int stop = time2index(s, end, Rounding.CEIL, true);
    double[] data = s.getData();
    int n = data.length;
    int before = Math.max(0, -start);
    int after = Math.max(0, stop - (n - 1));
    if (before == 0 && after == 0) {
      return;
    }
    double[] d = new double[before + n + after];
    System.arraycopy(data, 0, d, before, n);
    if (mode == PadMode.LINEAR_RAMP && n > 0) {
      double first = data[0];
      double last = data[n - 1];
      for (int i = 0; i < before; i++) {
        d[i] = first * i / before;
      }
      for (int i = 0; i < after; i++) {
        d[before + n + i] = last - last * (i + 1) / after;
      }
    }
    s.setData(d);
    s.setBeginTime(s.getBeginTime() - samplesToMillis(s.getDelta(), before));
  }

  /**
   * Remove the least squares straight line from the data.
   *
   * @param s The seismogram
   */
  public static void detrend(Seismogram s) {
    double[] d = s.getData();
    int n = d.length;
    if (n == 0) {
      return;
    }
    if (n == 1) {
      d[0] = 0.;
      return;
    }
    double xm = (n - 1) / 2.;
    double ym = mean(d);
    double sxy = 0., sxx = 0.;
    for (int i = 0; i < n; i++) {
      sxy += (i - xm) * (d[i] - ym);
      sxx += (i - xm) * (i - xm);
    }
    double slope = sxy / sxx;
    for (int i = 0; i < n; i++) {
      d[i] = d[i] - ym - slope * (i - xm);
    }
  }

  /**
   * Apply a symmetric Hann taper to the ends of the data. A Hann window of floor(width/delta)
   * samples is split in half and the halves applied to the beginning and end.
   *
   * @param s The seismogram
   * @param width Total duration of both ramps in seconds
   */
  public static void taper(Seismogram s, double width) {
    double[] d = s.getData();
    int nsamples = (int) Math.floor(width / s.getDelta() + 1.e-9);
    if (nsamples > d.length) {
      throw new IllegalArgumentException("Taper width " + width + " is longer than the seismogram");
    }
    if (nsamples < 2) {
      return;
    }
    double[] w = hann(nsamples);
    int ramp = nsamples / 2;
    int n = d.length;
    for (int i = 0; i < ramp; i++) {
      d[i] *= w[i];
      d[n - ramp + i] *= w[nsamples - ramp + i];
    }
  }

  /**
   * Symmetric Hann window.
   *
   * @param n Number of points
   * @return the window values
   */
  public static double[] hann(int n) {
    double[] w = new double[n];
    if (n == 1) {
      w[0] = 1.;
      return w;
    }
    for (int i = 0; i < n; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2. * Math.PI * i / (n - 1));
    }
    return w;
  }

  /**
   * Cut out a window of a seismogram extended on each side by a ramp, detrend it and taper the
   * ramps. Parts of the extended window outside of the data are zero filled.
   *
   * @param s The seismogram
   * @param begin The begin time of the window of interest
   * @param end The end time of the window of interest
   * @param ramp The duration in seconds of the ramp on each side
   */
  public static void window(Seismogram s, long begin, long end, double ramp) {
    long rampMS = Math.round(ramp * 1000.);
    long wbegin = begin - rampMS;
    long wend = end + rampMS;
    if (wbegin < s.getBeginTime() || wend > s.getEndTime()) {
      pad(s, wbegin, wend, PadMode.CONSTANT);
    }
    crop(s, wbegin, wend);
    detrend(s);
    taper(s, 2. * ramp);
  }

  /**
   * Divide the data by the maximum absolute value found between two times. If that maximum is
   * zero the data are left alone.
   *
   * @param s The seismogram
   * @param t1 Search for the maximum from this time (inclusive), null for the beginning
   * @param t2 Search for the maximum up to this time (exclusive), null for the end
   */
  public static void normalize(Seismogram s, Long t1, Long t2) {
    double[] d = s.getData();
    int start = t1 == null ? 0 : time2index(s, t1);
    int stop = t2 == null ? d.length : time2index(s, t2);
    double max = absMax(d, start, stop);
    if (max == 0.) {
      return;
    }
    for (int i = 0; i < d.length; i++) {
      d[i] /= max;
    }
  }

  /**
   * Resample to a new sampling interval with band limited (Lanczos windowed sinc) interpolation.
   * When the interval increases the kernel is stretched so it also low passes at the new Nyquist.
   * The new number of samples is int(nsamp*delta/newDelta).
   *
   * @param s The seismogram
   * @param newDelta The new sampling interval in seconds
   */
  public static void resample(Seismogram s, double newDelta) {
    if (!(newDelta > 0.)) {
      throw new IllegalArgumentException("Sampling interval must be positive delta=" + newDelta);
    }
    double delta = s.getDelta();
    if (newDelta == delta) {
      return;
    }
    double[] x = s.getData();
    int n = x.length;
    int npts = (int) (n * delta / newDelta + 1.e-9);
    double ratio = newDelta / delta;                 // input samples per output sample
    double fc = Math.min(1., 1. / ratio);             // cutoff as a fraction of the input Nyquist
    double halfWidth = RESAMPLE_LOBES / fc;
    double[] y = new double[npts];
    for (int k = 0; k < npts; k++) {
      double t = k * ratio;
      int i0 = Math.max(0, (int) Math.ceil(t - halfWidth));
      int i1 = Math.min(n - 1, (int) Math.floor(t + halfWidth));
      double sum = 0.;
      for (int i = i0; i <= i1; i++) {
        double u = fc * (t - i);
        sum += x[i] * fc * sinc(u) * sinc(u / RESAMPLE_LOBES);
      }
      y[k] = sum;
    }
    s.setData(y);
    s.setDelta(newDelta);
  }

  private static double sinc(double x) {
    if (Math.abs(x) < 1.e-12) {
      return 1.;
    }
    double px = Math.PI * x;
    return Math.sin(px) / px;
  }

  /**
   * @param d The data
   * @param start First index (inclusive)
   * @param stop Last index (exclusive)
   * @return The maximum absolute value in the range, zero if it is empty
   */
  public static double absMax(double[] d, int start, int stop) {
    double max = 0.;
    for (int i = Math.max(0, start); i < Math.min(d.length, stop); i++) {
      max = Math.max(max, Math.abs(d[i]));
    }
    return max;
  }

  public static double mean(double[] d) {
    if (d.length == 0) {
      return 0.;
    }
    double sum = 0.;
    for (double v : d) {
      sum += v;
    }
    return sum / d.length;
  }

  /**
   * Pearson correlation coefficient of two equal length series.
   *
   * @param a First series
   * @param b Second series
   * @return The coefficient, 0 if either series has no variance
   */
  public static double pearson(double[] a, double[] b) {
    if (a.length != b.length) {
      throw new InputLengthMismatchException(a.length, b.length);
    }
    return pearson(a, 0, b, 0, a.length);
  }

  /**
   * Pearson correlation coefficient of two equal length sections of two arrays.
   *
   * @param a First array
   * @param aoff Start of the section in a
   * @param b Second array
   * @param boff Start of the section in b
   * @param len Length of the sections
   * @return The coefficient, 0 if either section has no variance
   */
  public static double pearson(double[] a, int aoff, double[] b, int boff, int len) {
    if (len < 2) {
      return 0.;
    }
    double ma = 0., mb = 0.;
    for (int i = 0; i < len; i++) {
      ma += a[aoff + i];
      mb += b[boff + i];
    }
    ma /= len;
    mb /= len;
    double sab = 0., saa = 0., sbb = 0.;
    for (int i = 0; i < len; i++) {
      double da = a[aoff + i] - ma;
      double db = b[boff + i] - mb;
      sab += da * db;
      saa += da * da;
      sbb += db * db;
    }
    if (saa <= 0. || sbb <= 0.) {
      return 0.;
    }
    double r = sab / Math.sqrt(saa * sbb);
    return Math.max(-1., Math.min(1., r));
  }

  /**
   * Circularly shift an array, element i goes to (i+k) mod n.
   *
   * @param d The data
   * @param k The shift, may be negative
   * @return A new shifted array
   */
  public static double[] roll(double[] d, int k) {
    int n = d.length;
    double[] r = new double[n];
    if (n == 0) {
      return r;
    }
    int shift = ((k % n) + n) % n;
    for (int i = 0; i < n; i++) {
      r[(i + shift) % n] = d[i];
    }
    return r;
  }
}
