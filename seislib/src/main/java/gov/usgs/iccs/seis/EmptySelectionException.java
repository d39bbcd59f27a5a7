/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * Thrown when a stack is requested but no seismogram is selected to contribute to it.
 *
 * @author benz
 */
public class EmptySelectionException extends RuntimeException {

  /**
   * Creates a new instance of EmptySelectionException
   *
   * @param s Some text with the error
   */
  public EmptySelectionException(String s) {
    super(s);
  }

}
