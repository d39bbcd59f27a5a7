/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.xcorr;

import gov.usgs.iccs.util.Util;

/**
 * Delays and correlation coefficients of a list of seismograms measured against one template,
 * in the order of the list.
 *
 * @author benz
 */
public final class MultiDelayResult {

  private final int[] lags;
  private final double[] offsets;
  private final double[] coefficients;

  public MultiDelayResult(int[] lags, double[] offsets, double[] coefficients) {
    this.lags = lags;
    this.offsets = offsets;
    this.coefficients = coefficients;
  }

  public int size() {
    return offsets.length;
  }

  /**
   * @return Delay of each seismogram relative to the template in seconds
   */
  public double[] getOffsets() {
    return offsets;
  }

  public double[] getCoefficients() {
    return coefficients;
  }

  public DelayResult get(int i) {
    return new DelayResult(lags[i], offsets[i], coefficients[i]);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(30 * offsets.length + 10);
    for (int i = 0; i < offsets.length; i++) {
      sb.append(i).append(" ").append(Util.df24(offsets[i])).append(" ").append(Util.df24(coefficients[i])).append("\n");
    }
    return sb.toString();
  }
}
