/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

/**
 * The minimal contract every time series in this library is used through. The end time and number
 * of samples are derived from the begin time, sampling interval and data and are never stored.
 * <p>
 * Times are milliseconds since 1970 as used throughout the Edge/CWB code, sampling intervals are
 * in seconds.
 *
 * @author benz
 */
public interface Seismogram {

  /**
   * @return The time of the first sample in millis since 1970
   */
  long getBeginTime();

  void setBeginTime(long ms);

  /**
   * @return The sampling interval in seconds, always positive
   */
  double getDelta();

  void setDelta(double delta);

  /**
   * @return The samples, this is the live array and not a copy
   */
  double[] getData();

  void setData(double[] data);

  default int getNsamp() {
    return getData().length;
  }

  /**
   * @return The time of the last sample, begin + delta*(nsamp-1), in millis since 1970
   */
  default long getEndTime() {
    return getBeginTime() + Math.round(getDelta() * (getNsamp() - 1) * 1000.);
  }
}
