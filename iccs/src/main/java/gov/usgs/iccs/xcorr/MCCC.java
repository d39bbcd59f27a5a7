/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.xcorr;

import Jama.Matrix;
import Jama.SingularValueDecomposition;
import gov.usgs.iccs.seis.Seismogram;
import gov.usgs.iccs.util.Logger;
import gov.usgs.iccs.util.Util;
import java.util.List;

/**
 * Multi-channel cross correlation.  The delays between all pairs of seismograms are reconciled
 * into one time per seismogram by weighted least squares.
 * <p>
 * Each pair i &lt; j with a coefficient of at least minCc gives the equation t[j] - t[i] =
 * offset(i, j) weighted by cc^2.  The pair equations only fix the differences of the times so a
 * zero mean equation sum(t) = 0, weighted by the total pair weight, is added, and unless the
 * damping is zero a damping*I block pulls every time toward zero.  The system is solved with a QR
 * least squares solve (SVD pseudo inverse of the normal equations if that is rank deficient).  The
 * error of each time is rmse*sqrt(diag(inv(A'A))) of the weighted, damped system, where rmse is
 * computed from the unweighted pair residuals.  Too few seismograms or pairs give all zeros.
 *
 * @author benz
 */
public class MCCC {

  public static final double DEFAULT_MIN_CC = 0.5;
  public static final double DEFAULT_DAMPING = 0.1;

  private final Logger par;
  private boolean dbg;

  /**
   * @param parent Logger for output, if null output goes to Util.prt()
   */
  public MCCC(Logger parent) {
    par = parent;
  }

  public void setDebug(boolean t) {
    dbg = t;
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

  public MCCCResult mccc(List<? extends Seismogram> signals) {
    return mccc(signals, DEFAULT_MIN_CC, DEFAULT_DAMPING);
  }

  /**
   * Correlate all pairs of seismograms and solve for one time per seismogram.
   *
   * @param signals The seismograms, all with the same sampling interval
   * @param minCc Pairs with a coefficient below this are not used
   * @param damping Size of the damping term, 0 for none
   * @return The times, errors and misfit
   */
  public MCCCResult mccc(List<? extends Seismogram> signals, double minCc, double damping) {
    if (signals.size() < 2) {
      return MCCCResult.zeros(signals.size());
    }
    return solve(XCorr.multiMultiDelay(signals, false), minCc, damping);
  }

  /**
   * Solve for the times from an already computed delay matrix.
   *
   * @param m All pairs delays, row i is the reference
   * @param minCc Pairs with a coefficient below this are not used
   * @param damping Size of the damping term, 0 for none
   * @return The times, errors and misfit
   */
  public MCCCResult solve(DelayMatrix m, double minCc, double damping) {
    if (damping < 0.) {
      throw new IllegalArgumentException("Damping must not be negative damping=" + damping);
    }
    int n = m.size();
    if (n < 2) {
      return MCCCResult.zeros(n);
    }
    int npairs = 0;
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        if (m.getCoefficient(i, j) >= minCc) {
          npairs++;
        }
      }
    }
    if (npairs == 0) {
      prta("MCCC: no pairs with cc >= " + minCc + " of " + n + " seismograms, returning zeros");
      return MCCCResult.zeros(n);
    }

    int nrows = npairs + 1 + (damping > 0. ? n : 0);
    double[][] a = new double[nrows][n];
    double[][] b = new double[nrows][1];
    int[] pi = new int[npairs];
    int[] pj = new int[npairs];
    double wtot = 0.;
    int row = 0;
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        double cc = m.getCoefficient(i, j);
        if (cc < minCc) {
          continue;
        }
        double w = cc * cc;
        double sw = Math.sqrt(w);
        wtot += w;
        a[row][i] = -sw;
        a[row][j] = sw;
        b[row][0] = sw * m.getOffset(i, j);
        pi[row] = i;
        pj[row] = j;
        row++;
      }
    }
    // zero mean
    double swtot = Math.sqrt(wtot);
    for (int k = 0; k < n; k++) {
      a[row][k] = swtot;
    }
    row++;
    if (damping > 0.) {
      for (int k = 0; k < n; k++) {
        a[row + k][k] = damping;
      }
    }

    Matrix am = new Matrix(a);
    Matrix bm = new Matrix(b);
    Matrix ata = am.transpose().times(am);
    double[] times;
    try {
      times = am.solve(bm).getColumnPackedCopy();
    } catch (RuntimeException e) {
      prta("MCCC: least squares solve failed (" + e.getMessage() + ") using the pseudo inverse");
      times = pseudoInverse(ata).times(am.transpose().times(bm)).getColumnPackedCopy();
    }

    double sum = 0.;
    for (int k = 0; k < npairs; k++) {
      double r = times[pj[k]] - times[pi[k]] - m.getOffset(pi[k], pj[k]);
      sum += r * r;
    }
    double rmse = Math.sqrt(sum / npairs);

    double[] errors = new double[n];
    try {
      Matrix cov = ata.inverse();
      for (int k = 0; k < n; k++) {
        errors[k] = rmse * Math.sqrt(Math.abs(cov.get(k, k)));
      }
    } catch (RuntimeException e) {
      prta("MCCC: normal equations are singular, errors set to zero e=" + e.getMessage());
      errors = new double[n];
    }
    MCCCResult result = new MCCCResult(times, errors, rmse, npairs);
    if (dbg) {
      prt(result.toString());
    }
    return result;
  }

  /**
   * Pseudo inverse of a square symmetric matrix from its SVD, singular values which are tiny
   * compared to the largest are treated as zero.
   */
  private static Matrix pseudoInverse(Matrix m) {
    SingularValueDecomposition svd = new SingularValueDecomposition(m);
    double[] s = svd.getSingularValues();
    double tol = Math.max(m.getRowDimension(), m.getColumnDimension()) * (s.length > 0 ? s[0] : 0.) * 1.e-12;
    Matrix sinv = new Matrix(s.length, s.length);
    for (int i = 0; i < s.length; i++) {
      if (s[i] > tol) {
        sinv.set(i, i, 1. / s[i]);
      }
    }
    return svd.getV().times(sinv).times(svd.getU().transpose());
  }
}
