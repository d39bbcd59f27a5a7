/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.BandpassFilter;
import gov.usgs.iccs.seis.EmptySelectionException;
import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.seis.SeisUtil;
import gov.usgs.iccs.util.Logger;
import gov.usgs.iccs.util.Util;
import gov.usgs.iccs.xcorr.DelayResult;
import gov.usgs.iccs.xcorr.MultiDelayResult;
import gov.usgs.iccs.xcorr.XCorr;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Iterative cross correlation and stacking.  A list of seismograms of one event, each with a
 * pick, is aligned by repeatedly stacking the windowed seismograms, correlating every seismogram
 * against the stack and moving its pick (t1) by the delay found, until the stack stops changing.
 * Optionally seismograms with the wrong polarity are flipped and poorly correlating ones are
 * deselected from the stack as it goes.
 * <p>
 * The working copies, stacks, correlation coefficients and valid pick/window ranges are computed
 * when first asked for and kept until something they depend on changes.  Every parameter setter
 * clears them, and so does any change to the pick, flip or select of a seismogram, which is
 * noticed by comparing against a snapshot taken when the cache was cleared.
 * <p>
 * The caller owns the seismogram list.  ICCS changes only t1, flip and select of the seismograms.
 *
 * @author benz
 */
public class ICCS {

  /** Where the last (or current) run of the iteration is */
  public enum RunState {
    IDLE, ITERATING, CONVERGED, MAX_ITERATIONS
  }

  private final List<? extends ICCSSeismogram> seismograms;
  private final ICCSParams params;
  private final ICCSPrepare preparer;
  private final Logger par;
  private final List<ICCSWarning> warnings = new ArrayList<>(4);
  private RunState state = RunState.IDLE;

  // derived values, null until computed
  private List<MiniSeismogram> ccSeismograms;
  private List<MiniSeismogram> contextSeismograms;
  private MiniSeismogram ccStack;
  private MiniSeismogram contextStack;
  private double[] ccnorms;
  private long[] validPickRange;       // min/max offset in millis
  private long[] validWindowRange;     // earliest/latest window edge relative to the pick in millis

  // state of the seismograms when the cache was last cleared
  private Long[] snapT1;
  private boolean[] snapFlip;
  private boolean[] snapSelect;

  private final StringBuilder tmpsb = new StringBuilder(100);

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
      sb.append("ICCS: nseis=").append(seismograms.size()).append(" state=").append(state).append(" ");
      params.toStringBuilder(sb);
    }
    return sb;
  }

  /**
   * Create an ICCS with the default parameters.
   *
   * @param seismograms The seismograms to align
   */
  public ICCS(List<? extends ICCSSeismogram> seismograms) {
    this(seismograms, new ICCSParams(), null, null);
  }

  /**
   * Create an ICCS.
   *
   * @param seismograms The seismograms to align, this list is used and not copied
   * @param p The parameters, these are copied
   * @param filter The band pass filter to use, null for a Butterworth
   * @param parent Logger for output, null for Util.prt()
   * @throws ICCSParameterException if the window does not fit the selected seismograms
   */
  public ICCS(List<? extends ICCSSeismogram> seismograms, ICCSParams p, BandpassFilter filter, Logger parent) {
    this.seismograms = seismograms;
    this.params = new ICCSParams(p);
    this.preparer = new ICCSPrepare(filter);
    this.par = parent;
    if (params.getWindowPre() >= params.getWindowPost()) {
      throw new ICCSParameterException("Window start " + params.getWindowPre()
              + " must be before window end " + params.getWindowPost());
    }
    checkWindowFits(params.getWindowPre(), params.getWindowPost());
    invalidateAll();
  }

  protected void prt(String s) {
    if (par == null) {
      Util.prt(s);
    } else {
      par.prt(s);
    }
  }

  protected void prta(String s) {
    if (par == null) {
      Util.prta(s);
    } else {
      par.prta(s);
    }
  }

  /**
   * Clear every derived value and remember the current pick, flip and select of every
   * seismogram.
   */
  public final synchronized void invalidateAll() {
    ccSeismograms = null;
    contextSeismograms = null;
    ccStack = null;
    contextStack = null;
    ccnorms = null;
    validPickRange = null;
    validWindowRange = null;
    int n = seismograms.size();
    snapT1 = new Long[n];
    snapFlip = new boolean[n];
    snapSelect = new boolean[n];
    for (int i = 0; i < n; i++) {
      ICCSSeismogram s = seismograms.get(i);
      snapT1[i] = s.getT1();
      snapFlip[i] = s.isFlip();
      snapSelect[i] = s.isSelect();
    }
  }

  /** Clear the cache if any seismogram was changed since it was last cleared. */
  private void checkSeismograms() {
    int n = seismograms.size();
    boolean changed = n != snapT1.length;
    for (int i = 0; i < n && !changed; i++) {
      ICCSSeismogram s = seismograms.get(i);
      Long t1 = s.getT1();
      changed = s.isFlip() != snapFlip[i] || s.isSelect() != snapSelect[i]
              || (t1 == null ? snapT1[i] != null : !t1.equals(snapT1[i]));
    }
    if (changed) {
      invalidateAll();
    }
  }

  public List<? extends ICCSSeismogram> getSeismograms() {
    return seismograms;
  }

  /**
   * The cached derived values are only handed out as copies, the ones below return the cache
   * itself for use inside this package.
   */
  synchronized List<MiniSeismogram> ccCopies() {
    checkSeismograms();
    if (ccSeismograms == null) {
      ccSeismograms = Collections.unmodifiableList(
              preparer.prepare(seismograms, params, ICCSPrepare.Mode.CORRELATION));
    }
    return ccSeismograms;
  }

  synchronized List<MiniSeismogram> contextCopies() {
    checkSeismograms();
    if (contextSeismograms == null) {
      contextSeismograms = Collections.unmodifiableList(
              preparer.prepare(seismograms, params, ICCSPrepare.Mode.CONTEXT));
    }
    return contextSeismograms;
  }

  synchronized MiniSeismogram stack() {
    List<MiniSeismogram> cc = ccCopies();
    if (ccStack == null) {
      ccStack = StackBuilder.stack(cc, seismograms);
    }
    return ccStack;
  }

  synchronized MiniSeismogram contextStack() {
    List<MiniSeismogram> ctx = contextCopies();
    if (contextStack == null) {
      contextStack = StackBuilder.stack(ctx, seismograms);
    }
    return contextStack;
  }

  private static List<MiniSeismogram> copyAll(List<MiniSeismogram> list) {
    List<MiniSeismogram> out = new ArrayList<>(list.size());
    for (MiniSeismogram s : list) {
      out.add(MiniSeismogram.copyOf(s));
    }
    return out;
  }

  /**
   * @return Copies of the working copies used for the correlation (window plus taper)
   */
  public synchronized List<MiniSeismogram> getCcSeismograms() {
    return copyAll(ccCopies());
  }

  /**
   * @return Copies of the working copies with extra context on each side of the window
   */
  public synchronized List<MiniSeismogram> getContextSeismograms() {
    return copyAll(contextCopies());
  }

  /**
   * @return A copy of the stack of the selected correlation working copies
   * @throws EmptySelectionException if no seismogram is selected
   */
  public synchronized MiniSeismogram getStack() {
    return MiniSeismogram.copyOf(stack());
  }

  /**
   * @return A copy of the stack of the selected context working copies
   * @throws EmptySelectionException if no seismogram is selected
   */
  public synchronized MiniSeismogram getContextStack() {
    return MiniSeismogram.copyOf(contextStack());
  }

  /**
   * @return The Pearson correlation of each correlation working copy with the stack
   */
  public synchronized double[] getCcnorms() {
    List<MiniSeismogram> cc = ccCopies();
    MiniSeismogram stack = stack();
    if (ccnorms == null) {
      double[] r = new double[cc.size()];
      for (int i = 0; i < r.length; i++) {
        r[i] = SeisUtil.pearson(cc.get(i).getData(), stack.getData());
      }
      ccnorms = r;
    }
    return ccnorms.clone();
  }

  public synchronized RunState getState() {
    return state;
  }

  /**
   * @return The unreachable pick warnings of the last run
   */
  public synchronized List<ICCSWarning> getWarnings() {
    return new ArrayList<>(warnings);
  }

  /**
   * Run with the iteration settings from the parameters.
   *
   * @return The convergence value of each iteration
   */
  public List<Double> run() {
    return run(params.isAutoflip(), params.isAutoselect(), params.getConvergenceLimit(),
            params.getConvergenceMethod(), params.getMaxIterations(), params.getMaxShift(), params.isParallel());
  }

  /**
   * Iterate: correlate every working copy against the stack, flip/select/move the pick of each
   * seismogram accordingly and restack, until the convergence value is at or below the limit or
   * the iterations run out.  A pick which would put the window outside of the data is not made,
   * a warning is recorded for it and the run goes on.
   *
   * @param autoflip Flip seismograms which correlate negatively with the stack
   * @param autoselect Select only seismograms with |cc| at least the minimum ccnorm
   * @param convergenceLimit Stop when the convergence value is at or below this
   * @param method How the convergence value is computed
   * @param maxIterations The most iterations to do, at least 1
   * @param maxShift If not null, the largest delay in seconds searched
   * @param parallel Correlate the seismograms in parallel threads
   * @return The convergence value of each iteration
   * @throws EmptySelectionException if no seismogram is (or stays) selected
   */
  public synchronized List<Double> run(boolean autoflip, boolean autoselect, double convergenceLimit,
          ConvergenceMethod method, int maxIterations, Double maxShift, boolean parallel) {
    if (maxIterations < 1) {
      throw new ICCSParameterException("Maximum iterations must be at least 1 maxiter=" + maxIterations);
    }
    if (method == null) {
      throw new ICCSParameterException("Convergence method cannot be null");
    }
    warnings.clear();
    List<Double> history = new ArrayList<>(maxIterations);
    state = RunState.ITERATING;
    long preMS = Math.round(params.getWindowPre() * 1000.);
    long postMS = Math.round(params.getWindowPost() * 1000.);
    try {
      for (int iter = 1; iter <= maxIterations; iter++) {
        MiniSeismogram prevStack = getStack();
        List<MiniSeismogram> cc = ccCopies();
        DelayResult[] delays = correlate(prevStack, cc, autoflip, maxShift, parallel);

        for (int i = 0; i < seismograms.size(); i++) {
          ICCSSeismogram s = seismograms.get(i);
          double coef = delays[i].getCoefficient();
          if (autoflip && coef < 0.) {
            s.setFlip(!s.isFlip());
            coef = Math.abs(coef);
          }
          if (autoselect) {
            s.setSelect(Math.abs(coef) >= params.getMinCcnorm());
          }
          long candidate = s.getPick() + Math.round(delays[i].getOffset() * 1000.);
          long earliest = s.getBeginTime() - preMS;
          long latest = s.getEndTime() - postMS;
          if (candidate >= earliest && candidate <= latest) {
            s.setT1(candidate);
          } else {
            ICCSWarning w = new ICCSWarning(i, iter, candidate, earliest, latest);
            warnings.add(w);
            prta("ICCS: " + w);
          }
        }
        invalidateAll();

        double value = method.value(stack().getData(), prevStack.getData());
        history.add(value);
        prta("ICCS: iter=" + iter + " " + method + "=" + Util.ef6(value)
                + (params.isDebug() ? " nwarn=" + warnings.size() + " " + stack() : ""));
        if (value <= convergenceLimit) {
          state = RunState.CONVERGED;
          prta("ICCS: converged after " + iter + " iterations " + method + "=" + Util.ef6(value));
          return history;
        }
      }
      state = RunState.MAX_ITERATIONS;
      prta("ICCS: stopped after " + maxIterations + " iterations without converging last="
              + Util.ef6(history.get(history.size() - 1)));
      return history;
    } catch (RuntimeException e) {
      state = RunState.IDLE;
      throw e;
    }
  }

  /**
   * Correlate every working copy against the stack.  Serially without a maximum shift one
   * multiDelay does them all, otherwise each copy is done with the pairwise delay, in parallel
   * threads if requested.
   */
  private DelayResult[] correlate(final MiniSeismogram stack, final List<MiniSeismogram> cc,
          final boolean absMax, final Double maxShift, boolean parallel) {
    final DelayResult[] delays = new DelayResult[cc.size()];
    if (!parallel && maxShift == null) {
      MultiDelayResult m = XCorr.multiDelay(stack, cc, absMax);
      for (int i = 0; i < delays.length; i++) {
        delays[i] = m.get(i);
      }
      return delays;
    }
    if (!parallel) {
      for (int i = 0; i < delays.length; i++) {
        delays[i] = XCorr.delay(stack, cc.get(i), false, maxShift, absMax);
      }
      return delays;
    }
    int nthreads = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), delays.length));
    Thread[] threads = new Thread[nthreads];
    final AtomicInteger next = new AtomicInteger(0);
    final RuntimeException[] failure = new RuntimeException[1];
    for (int ithread = 0; ithread < nthreads; ithread++) {
      threads[ithread] = new Thread("ICCS-xcorr-" + ithread) {
        @Override
        public void run() {
          for (int i = next.getAndIncrement(); i < delays.length; i = next.getAndIncrement()) {
            try {
              delays[i] = XCorr.delay(stack, cc.get(i), false, maxShift, absMax);
            } catch (RuntimeException e) {
              synchronized (failure) {
                if (failure[0] == null) {
                  failure[0] = e;
                }
              }
              return;
            }
          }
        }
      };
      threads[ithread].start();
    }
    try {
      for (Thread t : threads) {
        t.join();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted waiting for the correlation threads", e);
    }
    synchronized (failure) {
      if (failure[0] != null) {
        throw failure[0];
      }
    }
    return delays;
  }

  /**
   * Check that a window fits around the current pick of every selected seismogram.
   *
   * @throws ICCSParameterException if it does not
   */
  private void checkWindowFits(double pre, double post) {
    long preMS = Math.round(pre * 1000.);
    long postMS = Math.round(post * 1000.);
    for (int i = 0; i < seismograms.size(); i++) {
      ICCSSeismogram s = seismograms.get(i);
      if (!s.isSelect()) {
        continue;
      }
      long pick = s.getPick();
      if (pick + preMS < s.getBeginTime()) {
        throw new ICCSParameterException("Window start " + pre + " is before the data of seismogram "
                + i + " begin=" + Util.ascdatetime2(s.getBeginTime()) + " pick=" + Util.ascdatetime2(pick));
      }
      if (pick + postMS > s.getEndTime()) {
        throw new ICCSParameterException("Window end " + post + " is after the data of seismogram "
                + i + " end=" + Util.ascdatetime2(s.getEndTime()) + " pick=" + Util.ascdatetime2(pick));
      }
    }
  }

  /**
   * @return {min, max} offset in seconds which all of the selected picks can be moved by and
   * still have the window inside their data, infinite if nothing is selected
   */
  public synchronized double[] getValidPickRange() {
    checkSeismograms();
    if (validPickRange == null) {
      long preMS = Math.round(params.getWindowPre() * 1000.);
      long postMS = Math.round(params.getWindowPost() * 1000.);
      long min = Long.MIN_VALUE;
      long max = Long.MAX_VALUE;
      for (ICCSSeismogram s : seismograms) {
        if (s.isSelect()) {
          min = Math.max(min, s.getBeginTime() - s.getPick() - preMS);
          max = Math.min(max, s.getEndTime() - s.getPick() - postMS);
        }
      }
      validPickRange = new long[]{min, max};
    }
    return toSeconds(validPickRange);
  }

  /**
   * @return {earliest, latest} in seconds relative to the pick which a window can reach and stay
   * inside the data of every selected seismogram, infinite if nothing is selected
   */
  public synchronized double[] getValidTimeWindowRange() {
    checkSeismograms();
    if (validWindowRange == null) {
      long min = Long.MIN_VALUE;
      long max = Long.MAX_VALUE;
      for (ICCSSeismogram s : seismograms) {
        if (s.isSelect()) {
          min = Math.max(min, s.getBeginTime() - s.getPick());
          max = Math.min(max, s.getEndTime() - s.getPick());
        }
      }
      validWindowRange = new long[]{min, max};
    }
    return toSeconds(validWindowRange);
  }

  private static double[] toSeconds(long[] range) {
    return new double[]{
      range[0] == Long.MIN_VALUE ? Double.NEGATIVE_INFINITY : range[0] / 1000.,
      range[1] == Long.MAX_VALUE ? Double.POSITIVE_INFINITY : range[1] / 1000.};
  }

  /**
   * Would moving every pick by this offset keep the window inside the data of all selected
   * seismograms?
   *
   * @param offset The offset in seconds
   * @return true if it would
   */
  public synchronized boolean validatePick(double offset) {
    double[] range = getValidPickRange();
    return offset >= range[0] - 1.e-9 && offset <= range[1] + 1.e-9;
  }

  /**
   * Is this window valid: pre before post, each at least one sample from the pick, and inside
   * the data of all selected seismograms?
   *
   * @param pre Window start relative to the pick in seconds
   * @param post Window end relative to the pick in seconds
   * @return true if it is
   */
  public synchronized boolean validateTimeWindow(double pre, double post) {
    double delta = ICCSPrepare.referenceDelta(seismograms);
    if (pre >= post || pre > -delta || post < delta) {
      return false;
    }
    double[] range = getValidTimeWindowRange();
    return pre >= range[0] - 1.e-9 && post <= range[1] + 1.e-9;
  }

  /**
   * Move the pick of every seismogram by the same offset.
   *
   * @param offset The offset in seconds
   * @throws ICCSParameterException if a selected window would leave its data
   */
  public synchronized void updateAllPicks(double offset) {
    if (!validatePick(offset)) {
      double[] range = getValidPickRange();
      throw new ICCSParameterException("Pick offset " + offset + " not in the valid range "
              + range[0] + " to " + range[1]);
    }
    long ms = Math.round(offset * 1000.);
    for (ICCSSeismogram s : seismograms) {
      s.setT1(s.getPick() + ms);
    }
    invalidateAll();
  }

  public synchronized ICCSParams getParams() {
    return new ICCSParams(params);
  }

  public synchronized double getWindowPre() {
    return params.getWindowPre();
  }

  /**
   * @param pre New window start relative to the pick in seconds, negative
   * @throws ICCSParameterException if it is invalid or not inside the data of a selected
   * seismogram
   */
  public synchronized void setWindowPre(double pre) {
    if (pre == params.getWindowPre()) {
      return;
    }
    if (!(pre < 0.)) {
      throw new ICCSParameterException("Window start must be negative pre=" + pre);
    }
    checkWindowFits(pre, params.getWindowPost());
    params.setWindowPre(pre);
    invalidateAll();
  }

  public synchronized double getWindowPost() {
    return params.getWindowPost();
  }

  /**
   * @param post New window end relative to the pick in seconds, positive
   * @throws ICCSParameterException if it is invalid or not inside the data of a selected
   * seismogram
   */
  public synchronized void setWindowPost(double post) {
    if (post == params.getWindowPost()) {
      return;
    }
    if (!(post > 0.)) {
      throw new ICCSParameterException("Window end must be positive post=" + post);
    }
    checkWindowFits(params.getWindowPre(), post);
    params.setWindowPost(post);
    invalidateAll();
  }

  /**
   * Set both edges of the window at once.
   *
   * @param pre New window start relative to the pick in seconds
   * @param post New window end relative to the pick in seconds
   * @throws ICCSParameterException if validateTimeWindow() rejects the window
   */
  public synchronized void setTimeWindow(double pre, double post) {
    if (pre == params.getWindowPre() && post == params.getWindowPost()) {
      return;
    }
    if (!validateTimeWindow(pre, post)) {
      throw new ICCSParameterException("Invalid time window " + pre + " to " + post);
    }
    checkWindowFits(pre, post);
    params.setWindowPre(pre);
    params.setWindowPost(post);
    invalidateAll();
  }

  public synchronized double getContextWidth() {
    return params.getContextWidth();
  }

  public synchronized void setContextWidth(double d) {
    if (d == params.getContextWidth()) {
      return;
    }
    params.setContextWidth(d);
    invalidateAll();
  }

  public synchronized double getRampWidth() {
    return params.getRampWidth();
  }

  public synchronized boolean isRampFraction() {
    return params.isRampFraction();
  }

  public synchronized void setRampWidth(double d, boolean fraction) {
    if (d == params.getRampWidth() && fraction == params.isRampFraction()) {
      return;
    }
    params.setRampWidth(d, fraction);
    invalidateAll();
  }

  public synchronized boolean isBandpassApply() {
    return params.isBandpassApply();
  }

  public synchronized void setBandpassApply(boolean t) {
    if (t == params.isBandpassApply()) {
      return;
    }
    params.setBandpassApply(t);
    invalidateAll();
  }

  public synchronized void setBandpass(double fmin, double fmax) {
    if (fmin == params.getBandpassFmin() && fmax == params.getBandpassFmax()) {
      return;
    }
    params.setBandpass(fmin, fmax);
    invalidateAll();
  }

  public synchronized double getMinCcnorm() {
    return params.getMinCcnorm();
  }

  /**
   * @param d Minimum normalized correlation to stay selected, 0 to 1
   */
  public synchronized void setMinCcnorm(double d) {
    if (d == params.getMinCcnorm()) {
      return;
    }
    params.setMinCcnorm(d);
    invalidateAll();
  }

  public synchronized void setDebug(boolean t) {
    params.setDebug(t);
  }
}
