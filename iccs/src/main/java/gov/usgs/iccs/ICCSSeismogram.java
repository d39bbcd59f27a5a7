/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.Seismogram;
import java.util.Map;

/**
 * A seismogram which can be aligned by ICCS.  Besides the data it carries the initial pick
 * (t0), the refined pick (t1) which ICCS produces, a flip flag which negates the data wherever it
 * is used, and a select flag which keeps it out of (but not away from) the stack.  ICCS only ever
 * changes t1, flip and select.
 *
 * @author benz
 */
public interface ICCSSeismogram extends Seismogram {

  /**
   * @return The initial pick in millis since 1970
   */
  long getT0();

  /**
   * @return The refined pick in millis since 1970, or null if there is none yet
   */
  Long getT1();

  void setT1(Long t1);

  boolean isFlip();

  void setFlip(boolean flip);

  boolean isSelect();

  void setSelect(boolean select);

  /**
   * @return Caller owned metadata, never looked at by ICCS
   */
  Map<String, Object> getExtra();

  /**
   * @return The refined pick if there is one, otherwise the initial pick
   */
  default long getPick() {
    Long t1 = getT1();
    return t1 == null ? getT0() : t1;
  }
}
