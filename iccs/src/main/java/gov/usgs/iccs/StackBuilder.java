/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.EmptySelectionException;
import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.seis.Seismogram;
import java.util.List;

/**
 * Averages the working copies of the selected seismograms into a stack.
 *
 * @author benz
 */
public final class StackBuilder {

  private StackBuilder() {
  }

  /**
   * Sample by sample mean of the copies whose parent is selected.  The begin time is the mean
   * begin time of those copies and the sampling interval that of the first copy.
   *
   * @param copies The working copies, all the same length and sampling interval
   * @param parents The seismograms the copies were made from, in the same order
   * @return The stack
   * @throws EmptySelectionException if no parent is selected
   */
  public static MiniSeismogram stack(List<? extends Seismogram> copies, List<? extends ICCSSeismogram> parents) {
    if (copies.size() != parents.size()) {
      throw new IllegalArgumentException("Need one parent per copy " + copies.size() + " != " + parents.size());
    }
    double[] sum = null;
    long firstBegin = 0;
    double beginOffsets = 0.;
    int n = 0;
    for (int i = 0; i < copies.size(); i++) {
      if (!parents.get(i).isSelect()) {
        continue;
      }
      Seismogram c = copies.get(i);
      double[] d = c.getData();
      if (sum == null) {
        sum = new double[d.length];
        firstBegin = c.getBeginTime();
      }
      for (int j = 0; j < Math.min(sum.length, d.length); j++) {
        sum[j] += d[j];
      }
      // offsets from the first begin time so the millis do not overflow
      beginOffsets += c.getBeginTime() - firstBegin;
      n++;
    }
    if (n == 0) {
      throw new EmptySelectionException("Cannot stack, no seismograms are selected of " + copies.size());
    }
    for (int j = 0; j < sum.length; j++) {
      sum[j] /= n;
    }
    return new MiniSeismogram(firstBegin + Math.round(beginOffsets / n), copies.get(0).getDelta(), sum);
  }
}
