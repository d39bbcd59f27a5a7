/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * Thrown when an operation needs equal length inputs (a restricted lag search) and gets
 * seismograms with different numbers of samples.
 *
 * @author benz
 */
public class InputLengthMismatchException extends RuntimeException {

  /**
   * Creates a new instance of InputLengthMismatchException
   *
   * @param n1 Number of samples in the first input
   * @param n2 Number of samples in the second input
   */
  public InputLengthMismatchException(int n1, int n2) {
    super("Inputs must have the same length " + n1 + " != " + n2);
  }

}
