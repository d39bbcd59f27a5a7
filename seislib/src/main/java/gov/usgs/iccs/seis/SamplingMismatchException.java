/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * This exception is thrown by the correlation routines when two seismograms do not share the same
 * sampling interval. Seismograms are never resampled automatically to make them match.
 *
 * @author benz
 */
public class SamplingMismatchException extends RuntimeException {

  private final double delta1;
  private final double delta2;

  /**
   * Creates a new instance of SamplingMismatchException
   *
   * @param delta1 The sampling interval of the first seismogram in seconds
   * @param delta2 The sampling interval of the offending seismogram in seconds
   */
  public SamplingMismatchException(double delta1, double delta2) {
    super("Sampling intervals differ " + delta1 + " != " + delta2);
    this.delta1 = delta1;
    this.delta2 = delta2;
  }

  public double getDelta1() {
    return delta1;
  }

  public double getDelta2() {
    return delta2;
  }
}
