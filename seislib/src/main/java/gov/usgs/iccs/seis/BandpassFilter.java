/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * A band pass filter which can be applied to a seismogram in place.
 *
 * @author benz
 */
public interface BandpassFilter {

  /**
   * Band pass filter the data of a seismogram in place.
   *
   * @param seis The seismogram to filter
   * @param fmin The low corner in Hz
   * @param fmax The high corner in Hz
   * @param zerophase If true, the filter is applied forward and backward
   * @throws IllegalArgumentException if the corners are not 0 &lt; fmin &lt; fmax &lt; Nyquist
   */
  void bandpass(Seismogram seis, double fmin, double fmax, boolean zerophase);
}
