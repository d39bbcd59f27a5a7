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
 * The result of correlating one seismogram against another: the time the features in the second
 * seismogram occur after the same features in the first, and the normalized correlation
 * coefficient of the overlapping samples after aligning them.
 *
 * @author benz
 */
public final class DelayResult {

  private final int lag;
  private final double offset;
  private final double coefficient;

  public DelayResult(int lag, double offset, double coefficient) {
    this.lag = lag;
    this.offset = offset;
    this.coefficient = coefficient;
  }

  /**
   * @return The best lag in samples
   */
  public int getLag() {
    return lag;
  }

  /**
   * @return The delay in seconds
   */
  public double getOffset() {
    return offset;
  }

  /**
   * @return Pearson correlation coefficient of the aligned overlap, -1 to 1
   */
  public double getCoefficient() {
    return coefficient;
  }

  @Override
  public String toString() {
    return toStringBuilder(null).toString();
  }

  public StringBuilder toStringBuilder(StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = new StringBuilder(50);
    }
    sb.append("delay=").append(Util.df24(offset)).append(" lag=").append(lag).
            append(" cc=").append(Util.df24(coefficient));
    return sb;
  }
}
