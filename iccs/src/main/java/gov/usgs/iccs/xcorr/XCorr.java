/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.xcorr;

import gov.usgs.iccs.seis.FFT;
import gov.usgs.iccs.seis.InputLengthMismatchException;
import gov.usgs.iccs.seis.SamplingMismatchException;
import gov.usgs.iccs.seis.SeisUtil;
import gov.usgs.iccs.seis.Seismogram;
import java.util.List;

/**
 * Frequency domain cross correlation of seismograms.
 * <p>
 * All of the routines compute r[lag] = sum(a[n]*b[n+lag]) for every lag where the two series
 * overlap, by zero padding both series to a power of two at least Na+Nb-1 long (so there is no
 * wrap around), multiplying conj(A) by B and inverse transforming.  Indices of the inverse
 * transform at or past Nb are negative lags, index - L.  The lag chosen is the maximum of r (or of
 * |r| when absMax is set, keeping its sign); lags are scanned from the most negative up and the
 * first strict maximum wins a tie.
 * <p>
 * A positive delay means the features of the second (matched) seismogram occur later in its data
 * than in the first (reference), so delay(s, roll(s, k)) is k*delta.  The coefficient reported is
 * never the correlation peak itself but the Pearson coefficient of the samples which overlap once
 * the two series are aligned at the chosen lag.
 *
 * @author benz
 */
public final class XCorr {

  private XCorr() {
  }

  /**
   * Delay of b relative to a using the full correlation.
   *
   * @param a Reference seismogram
   * @param b Matched seismogram
   * @return The delay and coefficient
   */
  public static DelayResult delay(Seismogram a, Seismogram b) {
    return delay(a, b, false, null, false);
  }

  /**
   * Delay of b relative to a.
   *
   * @param a Reference seismogram
   * @param b Matched seismogram
   * @param totalDelay If true, the begin time difference (b - a) is added to the delay
   * @param maxShift If not null, only delays up to +/- this many seconds are searched, this
   * requires a and b to be the same length
   * @param absMax Use the lag of the largest |correlation|, the coefficient keeps its sign
   * @return The delay and coefficient
   * @throws SamplingMismatchException if the sampling intervals differ
   * @throws InputLengthMismatchException if maxShift is given and the lengths differ
   * @throws IllegalArgumentException if maxShift is negative, infinite or NaN
   */
  public static DelayResult delay(Seismogram a, Seismogram b, boolean totalDelay, Double maxShift,
          boolean absMax) {
    double delta = checkDelta(a.getDelta(), b.getDelta());
    double[] da = a.getData();
    double[] db = b.getData();
    checkNotEmpty(da);
    checkNotEmpty(db);
    int minLag = -(da.length - 1);
    int maxLag = db.length - 1;
    if (maxShift != null) {
      if (maxShift.isNaN() || maxShift.isInfinite() || maxShift < 0.) {
        throw new IllegalArgumentException("Maximum shift must be finite and not negative maxShift=" + maxShift);
      }
      if (da.length != db.length) {
        throw new InputLengthMismatchException(da.length, db.length);
      }
      int limit = (int) Math.ceil(maxShift / delta - 1.e-9);
      minLag = Math.max(minLag, -limit);
      maxLag = Math.min(maxLag, limit);
    }
    int nn = FFT.nextPow2(da.length + db.length - 1);
    double[] r = correlate(FFT.forward(da, nn, 1.), FFT.forward(db, nn, 1.), nn);
    int lag = pickLag(r, nn, minLag, maxLag, absMax);
    double offset = lag * delta;
    if (totalDelay) {
      offset += (b.getBeginTime() - a.getBeginTime()) / 1000.;
    }
    return new DelayResult(lag, offset, overlapCoefficient(da, db, lag));
  }

  /**
   * Delays of many seismograms against one template.  The template is transformed once and every
   * series is normalized to zero mean and unit variance before it is transformed.
   *
   * @param template The reference seismogram
   * @param signals The seismograms to match against the template
   * @param absMax Use the lag of the largest |correlation|
   * @return The delay of each signal relative to the template, empty arrays for an empty list
   * @throws SamplingMismatchException if any sampling interval differs from the template's
   */
  public static MultiDelayResult multiDelay(Seismogram template, List<? extends Seismogram> signals,
          boolean absMax) {
    int n = signals.size();
    int[] lags = new int[n];
    double[] offsets = new double[n];
    double[] coefficients = new double[n];
    if (n == 0) {
      return new MultiDelayResult(lags, offsets, coefficients);
    }
    double delta = template.getDelta();
    double[] dt = template.getData();
    checkNotEmpty(dt);
    int maxlen = 0;
    for (Seismogram s : signals) {
      checkDelta(delta, s.getDelta());
      checkNotEmpty(s.getData());
      maxlen = Math.max(maxlen, s.getNsamp());
    }
    int nn = FFT.nextPow2(dt.length + maxlen - 1);
    double[] ct = FFT.forward(zscore(dt), nn, 1.);
    for (int i = 0; i < n; i++) {
      double[] ds = signals.get(i).getData();
      double[] r = correlate(ct, FFT.forward(zscore(ds), nn, 1.), nn);
      lags[i] = pickLag(r, nn, -(dt.length - 1), ds.length - 1, absMax);
      offsets[i] = lags[i] * delta;
      coefficients[i] = overlapCoefficient(dt, ds, lags[i]);
    }
    return new MultiDelayResult(lags, offsets, coefficients);
  }

  /**
   * Delays between all pairs of seismograms.  Every series is transformed once and each pair is
   * the product of two stored spectra.  Only pairs i &lt; j are correlated, the lower triangle is
   * the negated (offsets) or copied (coefficients) upper one.
   *
   * @param signals The seismograms
   * @param absMax Use the lag of the largest |correlation|
   * @return The delay matrix, row i is the reference for column j
   * @throws SamplingMismatchException if the sampling intervals are not all the same
   */
  public static DelayMatrix multiMultiDelay(List<? extends Seismogram> signals, boolean absMax) {
    int n = signals.size();
    double[][] offsets = new double[n][n];
    double[][] coefficients = new double[n][n];
    if (n == 0) {
      return new DelayMatrix(offsets, coefficients);
    }
    double delta = signals.get(0).getDelta();
    int maxlen = 0;
    for (Seismogram s : signals) {
      checkDelta(delta, s.getDelta());
      checkNotEmpty(s.getData());
      maxlen = Math.max(maxlen, s.getNsamp());
    }
    int nn = FFT.nextPow2(2 * maxlen - 1);
    double[][] spectra = new double[n][];
    for (int i = 0; i < n; i++) {
      spectra[i] = FFT.forward(zscore(signals.get(i).getData()), nn, 1.);
    }
    for (int i = 0; i < n; i++) {
      double[] di = signals.get(i).getData();
      coefficients[i][i] = SeisUtil.pearson(di, di);
      for (int j = i + 1; j < n; j++) {
        double[] dj = signals.get(j).getData();
        double[] r = correlate(spectra[i], spectra[j], nn);
        int lag = pickLag(r, nn, -(di.length - 1), dj.length - 1, absMax);
        offsets[i][j] = lag * delta;
        offsets[j][i] = -offsets[i][j];
        coefficients[i][j] = overlapCoefficient(di, dj, lag);
        coefficients[j][i] = coefficients[i][j];
      }
    }
    return new DelayMatrix(offsets, coefficients);
  }

  /**
   * Inverse transform of conj(A)*B.
   *
   * @param ca Spectrum of the reference
   * @param cb Spectrum of the matched series
   * @param nn The transform length
   * @return r[index] for index 0 to nn-1
   */
  private static double[] correlate(double[] ca, double[] cb, int nn) {
    double[] p = new double[2 * nn];
    for (int k = 0; k < nn; k++) {
      double ar = ca[2 * k];
      double ai = ca[2 * k + 1];
      double br = cb[2 * k];
      double bi = cb[2 * k + 1];
      p[2 * k] = ar * br + ai * bi;
      p[2 * k + 1] = ar * bi - ai * br;
    }
    FFT.doFFT(p, nn, 1, false, 1. / nn);
    double[] r = new double[nn];
    for (int k = 0; k < nn; k++) {
      r[k] = p[2 * k];
    }
    return r;
  }

  /**
   * Find the best lag between minLag and maxLag inclusive.
   */
  private static int pickLag(double[] r, int nn, int minLag, int maxLag, boolean absMax) {
    int best = minLag;
    int worst = minLag;
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    for (int lag = minLag; lag <= maxLag; lag++) {
      double v = r[lag < 0 ? nn + lag : lag];
      if (v > max) {
        max = v;
        best = lag;
      }
      if (v < min) {
        min = v;
        worst = lag;
      }
    }
    if (absMax && max < -min) {
      return worst;
    }
    return best;
  }

  /**
   * Pearson coefficient of a[n] and b[n+lag] where both exist.
   */
  static double overlapCoefficient(double[] a, double[] b, int lag) {
    int aoff, boff, len;
    if (lag >= 0) {
      aoff = 0;
      boff = lag;
      len = Math.min(a.length, b.length - lag);
    } else {
      aoff = -lag;
      boff = 0;
      len = Math.min(a.length + lag, b.length);
    }
    return SeisUtil.pearson(a, aoff, b, boff, len);
  }

  /**
   * Copy of the data with zero mean and unit variance, unit variance is skipped for a constant.
   */
  private static double[] zscore(double[] d) {
    double mean = SeisUtil.mean(d);
    double var = 0.;
    for (double v : d) {
      var += (v - mean) * (v - mean);
    }
    double std = Math.sqrt(var / d.length);
    if (std == 0.) {
      std = 1.;
    }
    double[] z = new double[d.length];
    for (int i = 0; i < d.length; i++) {
      z[i] = (d[i] - mean) / std;
    }
    return z;
  }

  private static double checkDelta(double d1, double d2) {
    if (Math.abs(d1 - d2) > 1.e-9 * Math.max(Math.abs(d1), Math.abs(d2))) {
      throw new SamplingMismatchException(d1, d2);
    }
    return d1;
  }

  private static void checkNotEmpty(double[] d) {
    if (d.length == 0) {
      throw new IllegalArgumentException("Cannot correlate a seismogram without data");
    }
  }
}
