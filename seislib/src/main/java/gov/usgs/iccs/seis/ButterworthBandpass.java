/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * Butterworth band pass made from a high pass at the low corner followed by a low pass at the
 * high corner, each with the configured number of poles.
 *
 * @author benz
 */
public class ButterworthBandpass implements BandpassFilter {

  private final int npoles;

  /**
   * @param corners The number of corners (poles) of each of the high and low pass filters
   */
  public ButterworthBandpass(int corners) {
    // HPLPFilter works in second order sections
    this.npoles = corners % 2 == 0 ? corners : corners + 1;
  }

  public ButterworthBandpass() {
    this(2);
  }

  public int getNpoles() {
    return npoles;
  }

  @Override
  public void bandpass(Seismogram seis, double fmin, double fmax, boolean zerophase) {
    if (!(fmin < fmax)) {
      throw new IllegalArgumentException("Band pass corners out of order fmin=" + fmin + " fmax=" + fmax);
    }
    double dt = seis.getDelta();
    HPLPFilter hp = new HPLPFilter(dt, fmin, npoles, true);
    HPLPFilter lp = new HPLPFilter(dt, fmax, npoles, false);
    double[] data = seis.getData();
    hp.apply(data, data.length, zerophase);
    lp.apply(data, data.length, zerophase);
  }
}
