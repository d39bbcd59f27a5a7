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
 * Relative times from a multi-channel cross correlation solution, one per seismogram, with their
 * uncertainties and the root mean square misfit of the pairwise delays.
 *
 * @author benz
 */
public final class MCCCResult {

  private final double[] times;
  private final double[] errors;
  private final double rmse;
  private final int npairs;

  public MCCCResult(double[] times, double[] errors, double rmse, int npairs) {
    this.times = times;
    this.errors = errors;
    this.rmse = rmse;
    this.npairs = npairs;
  }

  /**
   * A result of all zeros for a problem which could not be solved.
   *
   * @param n Number of seismograms
   * @return The empty result
   */
  public static MCCCResult zeros(int n) {
    return new MCCCResult(new double[n], new double[n], 0., 0);
  }

  /**
   * @return Time of each seismogram in seconds, the times sum to about zero
   */
  public double[] getTimes() {
    return times;
  }

  /**
   * @return Standard error of each time in seconds
   */
  public double[] getErrors() {
    return errors;
  }

  public double getRmse() {
    return rmse;
  }

  /**
   * @return The number of pairs with a coefficient at or above the minimum used in the solution
   */
  public int getNpairs() {
    return npairs;
  }

  @Override
  public String toString() {
    return toStringBuilder(null).toString();
  }

  public StringBuilder toStringBuilder(StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = new StringBuilder(40 * times.length + 40);
    }
    sb.append("MCCC npairs=").append(npairs).append(" rmse=").append(Util.df25(rmse)).append("\n");
    for (int i = 0; i < times.length; i++) {
      sb.append(i).append(" t=").append(Util.df25(times[i])).append(" +/- ").append(Util.df25(errors[i])).append("\n");
    }
    return sb;
  }
}
