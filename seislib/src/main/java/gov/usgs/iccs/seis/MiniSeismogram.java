/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.seis;

import gov.usgs.iccs.util.Util;

/**
 * A plain seismogram with nothing but a begin time, a sampling interval and the data. This is
 * what all of the derived working copies and stacks are.
 *
 * @author benz
 */
public class MiniSeismogram implements Seismogram {

  private long begin;
  private double delta;
  private double[] data;
  private final StringBuilder tmpsb = new StringBuilder(50);

  @Override
  public String toString() {
    return toStringBuilder(null).toString();
  }

  public StringBuilder toStringBuilder(StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = Util.clear(tmpsb);
    }
    synchronized (sb) {
      sb.append("Seis:").append(Util.ascdatetime2(begin)).append(" dt=").append(delta).
              append(" ns=").append(data.length);
    }
    return sb;
  }

  /**
   * Creates a new instance of MiniSeismogram
   *
   * @param begin Time of the first sample in millis
   * @param delta Sample interval in seconds, must be positive
   * @param data The samples, the array is used directly
   */
  public MiniSeismogram(long begin, double delta, double[] data) {
    if (!(delta > 0.)) {
      throw new IllegalArgumentException("Sampling interval must be positive delta=" + delta);
    }
    this.begin = begin;
    this.delta = delta;
    this.data = data;
  }

  /**
   * Make an independent copy of any seismogram (the data array is cloned).
   *
   * @param s The seismogram to copy
   * @return a new MiniSeismogram
   */
  public static MiniSeismogram copyOf(Seismogram s) {
    return new MiniSeismogram(s.getBeginTime(), s.getDelta(), s.getData().clone());
  }

  @Override
  public long getBeginTime() {
    return begin;
  }

  @Override
  public void setBeginTime(long ms) {
    begin = ms;
  }

  @Override
  public double getDelta() {
    return delta;
  }

  @Override
  public void setDelta(double d) {
    if (!(d > 0.)) {
      throw new IllegalArgumentException("Sampling interval must be positive delta=" + d);
    }
    delta = d;
  }

  @Override
  public double[] getData() {
    return data;
  }

  @Override
  public void setData(double[] d) {
    data = d;
  }
}
