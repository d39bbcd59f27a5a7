/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.util.Util;
import java.util.HashMap;
import java.util.Map;

/**
 * Plain ICCSSeismogram.  Select defaults to true and flip to false.
 *
 * @author benz
 */
public class MiniICCSSeismogram extends MiniSeismogram implements ICCSSeismogram {

  private final long t0;
  private Long t1;
  private boolean flip;
  private boolean select = true;
  private final Map<String, Object> extra = new HashMap<>(4);
  private final StringBuilder tmpsb = new StringBuilder(100);

  /**
   * @param begin Time of the first sample in millis
   * @param delta Sample interval in seconds
   * @param data The samples
   * @param t0 The initial pick in millis
   */
  public MiniICCSSeismogram(long begin, double delta, double[] data, long t0) {
    super(begin, delta, data);
    this.t0 = t0;
  }

  @Override
  public StringBuilder toStringBuilder(StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = Util.clear(tmpsb);
    }
    synchronized (sb) {
      super.toStringBuilder(sb);
      sb.append(" t0=").append(Util.ascdatetime2(t0));
      if (t1 != null) {
        sb.append(" t1=").append(Util.ascdatetime2(t1));
      }
      sb.append(" flip=").append(flip).append(" select=").append(select);
    }
    return sb;
  }

  @Override
  public long getT0() {
    return t0;
  }

  @Override
  public Long getT1() {
    return t1;
  }

  @Override
  public void setT1(Long t1) {
    this.t1 = t1;
  }

  @Override
  public boolean isFlip() {
    return flip;
  }

  @Override
  public void setFlip(boolean flip) {
    this.flip = flip;
  }

  @Override
  public boolean isSelect() {
    return select;
  }

  @Override
  public void setSelect(boolean select) {
    this.select = select;
  }

  @Override
  public Map<String, Object> getExtra() {
    return extra;
  }
}
