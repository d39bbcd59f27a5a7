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
 * All pairs delays and correlation coefficients.  Row i is the reference and column j the
 * matched seismogram, so getOffset(i, j) is how much later the features occur in j than in i.
 * The offsets are antisymmetric with a zero diagonal and the coefficients symmetric.
 *
 * @author benz
 */
public final class DelayMatrix {

  private final double[][] offsets;
  private final double[][] coefficients;

  public DelayMatrix(double[][] offsets, double[][] coefficients) {
    this.offsets = offsets;
    this.coefficients = coefficients;
  }

  public int size() {
    return offsets.length;
  }

  public double getOffset(int i, int j) {
    return offsets[i][j];
  }

  public double getCoefficient(int i, int j) {
    return coefficients[i][j];
  }

  public double[][] getOffsets() {
    return offsets;
  }

  public double[][] getCoefficients() {
    return coefficients;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(20 * offsets.length * offsets.length + 10);
    for (int i = 0; i < offsets.length; i++) {
      for (int j = 0; j < offsets.length; j++) {
        sb.append(Util.df23(offsets[i][j])).append("/").append(Util.df22(coefficients[i][j])).append(" ");
      }
      sb.append("\n");
    }
    return sb.toString();
  }
}
