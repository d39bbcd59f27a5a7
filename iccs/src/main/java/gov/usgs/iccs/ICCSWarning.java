/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.util.Util;

/**
 * A recoverable problem found during an ICCS run.  The only kind is an unreachable pick: the pick
 * update for one seismogram would have moved its window outside of the data, so that seismogram
 * kept its previous pick while the others were updated.
 *
 * @author benz
 */
public final class ICCSWarning {

  private final int index;
  private final int iteration;
  private final long candidate;
  private final long earliest;
  private final long latest;

  public ICCSWarning(int index, int iteration, long candidate, long earliest, long latest) {
    this.index = index;
    this.iteration = iteration;
    this.candidate = candidate;
    this.earliest = earliest;
    this.latest = latest;
  }

  /**
   * @return The index of the seismogram in the ICCS list
   */
  public int getIndex() {
    return index;
  }

  public int getIteration() {
    return iteration;
  }

  /**
   * @return The rejected pick in millis
   */
  public long getCandidate() {
    return candidate;
  }

  public long getEarliest() {
    return earliest;
  }

  public long getLatest() {
    return latest;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(120);
    sb.append("UnreachablePick seis=").append(index).append(" iter=").append(iteration).
            append(" pick ").append(Util.ascdatetime2(candidate)).append(" not in ");
    Util.ascdatetime2(earliest, sb).append(" to ");
    Util.ascdatetime2(latest, sb);
    return sb.toString();
  }
}
