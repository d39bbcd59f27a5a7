/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.BandpassFilter;
import gov.usgs.iccs.seis.ButterworthBandpass;
import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.seis.SeisUtil;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns ICCS seismograms into the working copies which are correlated and stacked.  For each
 * seismogram a copy is (1) band passed if that is on, (2) resampled to the smallest sampling
 * interval of all of the seismograms, then either
 * <ul>
 * <li>CORRELATION - cut to the window around the pick plus a taper ramp on each side (zero filled
 * outside of the data), detrended and tapered over the ramps, or</li>
 * <li>CONTEXT - cut to the window plus the context width on each side, padded with a ramp to zero
 * where that is outside of the data, and detrended,</li>
 * </ul>
 * (3) normalized by the largest absolute value inside the window and (4) negated if flip is set.
 * If the copies do not all have the same length they are all cut to the shortest one.  The input
 * seismograms are never changed.
 *
 * @author benz
 */
public class ICCSPrepare {

  /** Which kind of working copy to make */
  public enum Mode {
    CORRELATION, CONTEXT
  }

  private final BandpassFilter filter;

  /**
   * @param filter The band pass filter to use, null for a Butterworth
   */
  public ICCSPrepare(BandpassFilter filter) {
    this.filter = filter;
  }

  /**
   * @param p The parameters, only the band pass corners are used here
   * @return the filter to use
   */
  private BandpassFilter getFilter(ICCSParams p) {
    return filter == null ? new ButterworthBandpass(p.getBandpassCorners()) : filter;
  }

  /**
   * @param seismograms The seismograms
   * @return The smallest sampling interval of the seismograms
   */
  public static double referenceDelta(List<? extends ICCSSeismogram> seismograms) {
    double min = Double.MAX_VALUE;
    for (ICCSSeismogram s : seismograms) {
      min = Math.min(min, s.getDelta());
    }
    return min;
  }

  /**
   * Prepare working copies of all of the seismograms.
   *
   * @param seismograms The seismograms
   * @param p The window, taper and filter parameters
   * @param mode Correlation or context copies
   * @return One copy per seismogram in the same order, all the same length
   * @throws ICCSParameterException if the band pass cannot be applied to the data
   */
  public List<MiniSeismogram> prepare(List<? extends ICCSSeismogram> seismograms, ICCSParams p, Mode mode) {
    List<MiniSeismogram> copies = new ArrayList<>(seismograms.size());
    if (seismograms.isEmpty()) {
      return copies;
    }
    double refDelta = referenceDelta(seismograms);
    int minlen = Integer.MAX_VALUE;
    for (ICCSSeismogram s : seismograms) {
      MiniSeismogram copy = prepare(s, p, refDelta, mode);
      minlen = Math.min(minlen, copy.getNsamp());
      copies.add(copy);
    }
    for (MiniSeismogram copy : copies) {
      if (copy.getNsamp() != minlen) {
        copy.setData(Arrays.copyOf(copy.getData(), minlen));
      }
    }
    return copies;
  }

  /**
   * Prepare one working copy.
   *
   * @param s The seismogram
   * @param p The window, taper and filter parameters
   * @param refDelta The sampling interval the copy must have
   * @param mode Correlation or context copy
   * @return The copy
   */
  public MiniSeismogram prepare(ICCSSeismogram s, ICCSParams p, double refDelta, Mode mode) {
    long pick = s.getPick();
    long windowStart = pick + Math.round(p.getWindowPre() * 1000.);
    long windowEnd = pick + Math.round(p.getWindowPost() * 1000.);
    MiniSeismogram copy = MiniSeismogram.copyOf(s);

    if (p.isBandpassApply()) {
      try {
        getFilter(p).bandpass(copy, p.getBandpassFmin(), p.getBandpassFmax(), true);
      } catch (IllegalArgumentException e) {
        throw new ICCSParameterException("Cannot band pass " + p.getBandpassFmin() + "-"
                + p.getBandpassFmax() + " Hz at delta=" + copy.getDelta() + " : " + e.getMessage(), e);
      }
    }

    if (copy.getDelta() != refDelta) {
      SeisUtil.resample(copy, refDelta);
    }

    if (mode == Mode.CONTEXT) {
      long ctx = Math.round(p.getContextWidth() * 1000.);
      long start = windowStart - ctx;
      long end = windowEnd + ctx;
      if (start < copy.getBeginTime() || end > copy.getEndTime()) {
        SeisUtil.pad(copy, start, end, SeisUtil.PadMode.LINEAR_RAMP);
      }
      SeisUtil.crop(copy, start, end);
      SeisUtil.detrend(copy);
    } else {
      SeisUtil.window(copy, windowStart, windowEnd, p.getRampSeconds());
    }

    SeisUtil.normalize(copy, windowStart, windowEnd);

    if (s.isFlip()) {
      double[] d = copy.getData();
      for (int i = 0; i < d.length; i++) {
        d[i] = -d[i];
      }
    }
    return copy;
  }
}
