/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

/**
 * Thrown when an ICCS parameter or pick change is rejected.  When this is thrown nothing has been
 * changed.
 *
 * @author benz
 */
public class ICCSParameterException extends IllegalArgumentException {

  /**
   * Creates a new instance of ICCSParameterException
   *
   * @param s Some text with the error
   */
  public ICCSParameterException(String s) {
    super(s);
  }

  public ICCSParameterException(String s, Throwable cause) {
    super(s, cause);
  }
}
