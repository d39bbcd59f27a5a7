/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.util.Logger;
import gov.usgs.iccs.util.Util;

/**
 * The tunable parameters of an ICCS run, with their defaults, parsed from a command line in the
 * usual "-key value" form.  Each setter checks its own value and throws ICCSParameterException
 * leaving the old value in place.  Checks which need the seismograms (does the window fit the
 * data) are done by ICCS when the value is given to it.
 *
 * @author benz
 */
public final class ICCSParams {

  public static final String COMMANDLINEHELP
          = "Description of command line arguments and definition of variables\n"
          + " -pre secs     Start of the time window relative to the pick, negative (def=-15.)\n"
          + " -post secs    End of the time window relative to the pick, positive (def=15.)\n"
          + " -ctx secs     Extra time on each side of the window for the context seismograms (def=20.)\n"
          + " -ramp secs[%]  Length of the taper ramp on each side of the window in seconds, or percent of the window\n"
          + " -rampfrac f   Length of the taper ramp as a fraction of the window length (def=0.1)\n"
          + " -bp fmin/fmax[/corners] Band pass the seismograms before windowing (def off, 0.1/2./2)\n"
          + " -mincc cc     Minimum normalized correlation to stay selected (def=0.5)\n"
          + " -limit val    Convergence limit (def=0.00001)\n"
          + " -method m     Convergence method corrcoef or change (def=corrcoef)\n"
          + " -maxiter n    Maximum number of iterations (def=10)\n"
          + " -maxshift s   Maximum shift in seconds searched by the correlation (def unlimited)\n"
          + " -noflip       Do not flip the polarity of seismograms automatically\n"
          + " -noselect     Do not select/deselect seismograms automatically\n"
          + " -parallel     Correlate the seismograms in parallel threads\n"
          + " -dbg          Turn on debug output";

  private double windowPre = -15.;      // seconds relative to the pick
  private double windowPost = 15.;
  private double contextWidth = 20.;
  private double rampWidth = 0.1;       // fraction of the window or seconds
  private boolean rampFraction = true;
  private boolean bandpassApply;
  private double bandpassFmin = 0.1;
  private double bandpassFmax = 2.;
  private int bandpassCorners = 2;
  private double minCcnorm = 0.5;
  private double convergenceLimit = 1.e-5;
  private ConvergenceMethod convergenceMethod = ConvergenceMethod.CORRCOEF;
  private int maxIterations = 10;
  private Double maxShift;
  private boolean autoflip = true;
  private boolean autoselect = true;
  private boolean parallel;
  private boolean dbg;

  private final StringBuilder tmpsb = new StringBuilder(200);
  private final Logger par;

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
      sb.append("ICCS Parms : -pre ").append(windowPre).append(" -post ").append(windowPost).
              append(" -ctx ").append(contextWidth).
              append(rampFraction ? " -rampfrac " : " -ramp ").append(rampWidth);
      if (bandpassApply) {
        sb.append(" -bp ").append(bandpassFmin).append("/").append(bandpassFmax).append("/").append(bandpassCorners);
      }
      sb.append(" -mincc ").append(minCcnorm).append(" -limit ").append(convergenceLimit).
              append(" -method ").append(convergenceMethod.name().toLowerCase()).
              append(" -maxiter ").append(maxIterations);
      if (maxShift != null) {
        sb.append(" -maxshift ").append(maxShift);
      }
      if (!autoflip) {
        sb.append(" -noflip");
      }
      if (!autoselect) {
        sb.append(" -noselect");
      }
      if (parallel) {
        sb.append(" -parallel");
      }
      if (dbg) {
        sb.append(" -dbg");
      }
    }
    return sb;
  }

  /**
   * Default parameters.
   */
  public ICCSParams() {
    par = null;
  }

  /**
   * @param argline A command line of "-key value" pairs
   * @param parent Logger for messages, null for Util.prt()
   */
  public ICCSParams(String argline, Logger parent) {
    par = parent;
    String line = argline.trim();
    if (line.length() > 0) {
      parseArgs(line.split("\\s+"));
    }
  }

  public ICCSParams(String[] args, Logger parent) {
    par = parent;
    parseArgs(args);
  }

  /**
   * Copy constructor.
   *
   * @param p The parameters to copy
   */
  public ICCSParams(ICCSParams p) {
    par = p.par;
    windowPre = p.windowPre;
    windowPost = p.windowPost;
    contextWidth = p.contextWidth;
    rampWidth = p.rampWidth;
    rampFraction = p.rampFraction;
    bandpassApply = p.bandpassApply;
    bandpassFmin = p.bandpassFmin;
    bandpassFmax = p.bandpassFmax;
    bandpassCorners = p.bandpassCorners;
    minCcnorm = p.minCcnorm;
    convergenceLimit = p.convergenceLimit;
    convergenceMethod = p.convergenceMethod;
    maxIterations = p.maxIterations;
    maxShift = p.maxShift;
    autoflip = p.autoflip;
    autoselect = p.autoselect;
    parallel = p.parallel;
    dbg = p.dbg;
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

  private static String value(String[] args, int i) {
    if (i + 1 >= args.length) {
      throw new ICCSParameterException(args[i] + " needs a value\n" + COMMANDLINEHELP);
    }
    return args[i + 1];
  }

  private static double number(String[] args, int i) {
    String s = value(args, i);
    try {
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      throw new ICCSParameterException(args[i] + " value is not a number " + s, e);
    }
  }

  /**
   * Parse the command line arguments.  Unknown arguments are reported and skipped so the same
   * line can carry arguments for other parts of a program (like the input files).
   *
   * @param args The arguments
   */
  public void parseArgs(String[] args) {
    String[] list;
    for (int i = 0; i < args.length; i++) {
      if (args[i].equalsIgnoreCase("-pre")) {
        setWindowPre(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-post")) {
        setWindowPost(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-ctx")) {
        setContextWidth(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-ramp")) {
        String v = value(args, i);
        if (v.endsWith("%")) {
          try {
            setRampWidth(Double.parseDouble(v.substring(0, v.length() - 1)) / 100., true);
          } catch (NumberFormatException e) {
            throw new ICCSParameterException("-ramp value is not a percentage " + v, e);
          }
        } else {
          setRampWidth(number(args, i), false);
        }
        i++;
      } else if (args[i].equalsIgnoreCase("-rampfrac")) {
        setRampWidth(number(args, i), true);
        i++;
      } else if (args[i].equalsIgnoreCase("-bp")) {
        list = value(args, i).split("/");
        if (list.length < 2) {
          throw new ICCSParameterException("-bp fmin/fmax[/corners]");
        }
        try {
          setBandpass(Double.parseDouble(list[0]), Double.parseDouble(list[1]));
          if (list.length >= 3) {
            setBandpassCorners(Integer.parseInt(list[2]));
          }
        } catch (NumberFormatException e) {
          throw new ICCSParameterException("-bp fmin/fmax[/corners] bad number " + args[i + 1], e);
        }
        bandpassApply = true;
        i++;
      } else if (args[i].equalsIgnoreCase("-mincc")) {
        setMinCcnorm(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-limit")) {
        setConvergenceLimit(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-method")) {
        convergenceMethod = ConvergenceMethod.parse(value(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-maxiter")) {
        setMaxIterations((int) number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-maxshift")) {
        setMaxShift(number(args, i));
        i++;
      } else if (args[i].equalsIgnoreCase("-noflip")) {
        autoflip = false;
      } else if (args[i].equalsIgnoreCase("-noselect")) {
        autoselect = false;
      } else if (args[i].equalsIgnoreCase("-parallel")) {
        parallel = true;
      } else if (args[i].equalsIgnoreCase("-dbg")) {
        dbg = true;
      } else if (args[i].startsWith("-")) {
        prt("ICCSParams: unknown argument skipped " + args[i]);
      }
    }
    if (windowPre >= windowPost) {
      throw new ICCSParameterException("Window start " + windowPre + " must be before window end " + windowPost);
    }
  }

  public double getWindowPre() {
    return windowPre;
  }

  /**
   * @param d Start of the window relative to the pick in seconds, must be negative
   */
  public void setWindowPre(double d) {
    if (!(d < 0.)) {
      throw new ICCSParameterException("Window start must be negative pre=" + d);
    }
    windowPre = d;
  }

  public double getWindowPost() {
    return windowPost;
  }

  /**
   * @param d End of the window relative to the pick in seconds, must be positive
   */
  public void setWindowPost(double d) {
    if (!(d > 0.)) {
      throw new ICCSParameterException("Window end must be positive post=" + d);
    }
    windowPost = d;
  }

  public double getContextWidth() {
    return contextWidth;
  }

  public void setContextWidth(double d) {
    if (!(d > 0.)) {
      throw new ICCSParameterException("Context width must be positive ctx=" + d);
    }
    contextWidth = d;
  }

  public double getRampWidth() {
    return rampWidth;
  }

  public boolean isRampFraction() {
    return rampFraction;
  }

  /**
   * @param d The taper ramp on each side of the window
   * @param fraction If true, d is a fraction of the window length, otherwise seconds
   */
  public void setRampWidth(double d, boolean fraction) {
    if (!(d >= 0.) || Double.isInfinite(d)) {
      throw new ICCSParameterException("Taper ramp width must not be negative ramp=" + d);
    }
    rampWidth = d;
    rampFraction = fraction;
  }

  /**
   * @return The ramp on each side of the window in seconds for the current window
   */
  public double getRampSeconds() {
    return rampFraction ? rampWidth * (windowPost - windowPre) : rampWidth;
  }

  public boolean isBandpassApply() {
    return bandpassApply;
  }

  public void setBandpassApply(boolean t) {
    bandpassApply = t;
  }

  public double getBandpassFmin() {
    return bandpassFmin;
  }

  public double getBandpassFmax() {
    return bandpassFmax;
  }

  /**
   * @param fmin Low corner in Hz, positive
   * @param fmax High corner in Hz, above fmin
   */
  public void setBandpass(double fmin, double fmax) {
    if (!(fmin > 0.) || !(fmin < fmax)) {
      throw new ICCSParameterException("Band pass needs 0 < fmin < fmax fmin=" + fmin + " fmax=" + fmax);
    }
    bandpassFmin = fmin;
    bandpassFmax = fmax;
  }

  public int getBandpassCorners() {
    return bandpassCorners;
  }

  public void setBandpassCorners(int n) {
    if (n < 1) {
      throw new ICCSParameterException("Band pass corners must be at least 1 corners=" + n);
    }
    bandpassCorners = n;
  }

  public double getMinCcnorm() {
    return minCcnorm;
  }

  /**
   * @param d Minimum normalized correlation for auto selection, 0 to 1
   */
  public void setMinCcnorm(double d) {
    if (!(d >= 0. && d <= 1.)) {
      throw new ICCSParameterException("Minimum ccnorm must be between 0 and 1 mincc=" + d);
    }
    minCcnorm = d;
  }

  public double getConvergenceLimit() {
    return convergenceLimit;
  }

  public void setConvergenceLimit(double d) {
    if (!(d > 0.)) {
      throw new ICCSParameterException("Convergence limit must be positive limit=" + d);
    }
    convergenceLimit = d;
  }

  public ConvergenceMethod getConvergenceMethod() {
    return convergenceMethod;
  }

  public void setConvergenceMethod(ConvergenceMethod m) {
    if (m == null) {
      throw new ICCSParameterException("Convergence method cannot be null");
    }
    convergenceMethod = m;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int n) {
    if (n < 1) {
      throw new ICCSParameterException("Maximum iterations must be at least 1 maxiter=" + n);
    }
    maxIterations = n;
  }

  /**
   * @return The maximum shift searched in seconds, null for no limit
   */
  public Double getMaxShift() {
    return maxShift;
  }

  public void setMaxShift(Double d) {
    if (d != null && !(d > 0.)) {
      throw new ICCSParameterException("Maximum shift must be positive maxshift=" + d);
    }
    maxShift = d;
  }

  public boolean isAutoflip() {
    return autoflip;
  }

  public void setAutoflip(boolean t) {
    autoflip = t;
  }

  public boolean isAutoselect() {
    return autoselect;
  }

  public void setAutoselect(boolean t) {
    autoselect = t;
  }

  public boolean isParallel() {
    return parallel;
  }

  public void setParallel(boolean t) {
    parallel = t;
  }

  public boolean isDebug() {
    return dbg;
  }

  public void setDebug(boolean t) {
    dbg = t;
  }
}
