/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.SeisUtil;

/**
 * How the change of the stack between two iterations is measured.
 *
 * @author benz
 */
public enum ConvergenceMethod {
  /** 1 - Pearson correlation of the new and previous stack */
  CORRCOEF {
    @Override
    double compute(double[] stack, double[] prev, int n) {
      return 1. - SeisUtil.pearson(stack, 0, prev, 0, n);
    }
  },
  /** L1 norm of the difference / L2 norm of the new stack / number of samples */
  CHANGE {
    @Override
    double compute(double[] stack, double[] prev, int n) {
      double l1 = 0.;
      double l2 = 0.;
      for (int i = 0; i < n; i++) {
        l1 += Math.abs(stack[i] - prev[i]);
        l2 += stack[i] * stack[i];
      }
      if (l2 == 0.) {
        return l1 == 0. ? 0. : Double.POSITIVE_INFINITY;
      }
      return l1 / Math.sqrt(l2) / n;
    }
  };

  abstract double compute(double[] stack, double[] prev, int n);

  /**
   * Convergence value of a stack against the previous one over their common length.
   *
   * @param stack The new stack data
   * @param prev The previous stack data
   * @return The convergence value, smaller is more converged
   */
  public double value(double[] stack, double[] prev) {
    int n = Math.min(stack.length, prev.length);
    if (n == 0) {
      return 0.;
    }
    return compute(stack, prev, n);
  }

  /**
   * Parse a method name ignoring case.
   *
   * @param s "corrcoef" or "change"
   * @return The method
   * @throws ICCSParameterException if the name is unknown
   */
  public static ConvergenceMethod parse(String s) {
    for (ConvergenceMethod m : values()) {
      if (m.name().equalsIgnoreCase(s)) {
        return m;
      }
    }
    throw new ICCSParameterException("Unknown convergence method " + s + " use corrcoef or change");
  }
}
