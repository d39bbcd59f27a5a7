/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.util;

import java.io.PrintStream;
import java.text.DecimalFormat;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.TimeZone;

/**
 * Util.java contains the static helpers shared by the seismogram library and the alignment code:
 * the process wide log output (prt/prta), StringBuilder clearing, and the fixed precision number
 * and date formatting used by all of the toStringBuilder() methods.
 */
public class Util extends Object {

  public static final DecimalFormat df22 = new DecimalFormat("0.00");
  public static final DecimalFormat df23 = new DecimalFormat("0.000");
  public static final DecimalFormat df24 = new DecimalFormat("0.0000");
  public static final DecimalFormat df25 = new DecimalFormat("0.00000");
  public static final DecimalFormat ef6 = new DecimalFormat("0.000000E00");

  private static PrintStream out;       // where prt() and prta() go, System.out if null

  // synchronize on this when using it
  private static final GregorianCalendar gstat = new GregorianCalendar();

  static {
    gstat.setTimeZone(TimeZone.getTimeZone("UTC"));
  }

  public static final String df22(double i) {
    synchronized (df22) {
      return df22.format(i);
    }
  }

  public static final String df23(double i) {
    synchronized (df23) {
      return df23.format(i);
    }
  }

  public static final String df24(double i) {
    synchronized (df24) {
      return df24.format(i);
    }
  }

  public static final String df25(double i) {
    synchronized (df25) {
      return df25.format(i);
    }
  }

  public static final String ef6(double i) {
    synchronized (ef6) {
      return ef6.format(i);
    }
  }

  /**
   * Set the stream all of the static prt() output goes to.
   *
   * @param o The output stream, if null output goes to System.out
   */
  public static void setOutput(PrintStream o) {
    if (out != null && out != o && out != System.out && out != System.err) {
      out.close();
    }
    out = o;
  }

  public static PrintStream getOutput() {
    return out == null ? System.out : out;
  }

  /**
   * prt takes the input text and prints it out on the current output stream.
   *
   * @param sb The output text
   */
  public static void prt(CharSequence sb) {
    PrintStream o = getOutput();
    synchronized (o) {
      o.println(sb);
    }
  }

  /**
   * prta adds a time stamp (hh:mm:ss.mmm) to the output of prt().
   *
   * @param sb The output text
   */
  public static void prta(CharSequence sb) {
    PrintStream o = getOutput();
    StringBuilder time = asctime2();
    synchronized (o) {
      o.print(time);
      o.print(" ");
      o.println(sb);
    }
  }

  /**
   * return a time string for current time
   *
   * @return the time string hh:mm:ss.mmm
   */
  public static StringBuilder asctime2() {
    return asctime2(System.currentTimeMillis(), null);
  }

  /**
   * return a time string to the millisecond
   *
   * @param ms A milliseconds (1970 datum) to translate to time hh:mm:ss.mmm
   * @param tmp String builder for answer, if null a new one is returned
   * @return the time string hh:mm:ss.mmm
   */
  public static StringBuilder asctime2(long ms, StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = new StringBuilder(12);
    }
    synchronized (gstat) {
      gstat.setTimeInMillis(ms);
      append(gstat.get(Calendar.HOUR_OF_DAY), 2, '0', sb).append(":");
      append(gstat.get(Calendar.MINUTE), 2, '0', sb).append(":");
      append(gstat.get(Calendar.SECOND), 2, '0', sb).append(".");
      append(gstat.get(Calendar.MILLISECOND), 3, '0', sb);
    }
    return sb;
  }

  /**
   * Give a date/time string yyyy/mm/dd hh:mm:ss.mmm
   *
   * @param ms The millisecond date
   * @return the date/time string
   */
  public static StringBuilder ascdatetime2(long ms) {
    return ascdatetime2(ms, null);
  }

  /**
   * Give a date/time string yyyy/mm/dd hh:mm:ss.mmm
   *
   * @param ms The millisecond date
   * @param tmp The stringBuilder to add this data to, if null a new one is returned
   * @return the date/time string
   */
  public static StringBuilder ascdatetime2(long ms, StringBuilder tmp) {
    StringBuilder sb = tmp;
    if (sb == null) {
      sb = new StringBuilder(23);
    }
    synchronized (gstat) {
      gstat.setTimeInMillis(ms);
      append(gstat.get(Calendar.YEAR), 4, ' ', sb).append("/");
      append(gstat.get(Calendar.MONTH) + 1, 2, '0', sb).append("/");
      append(gstat.get(Calendar.DAY_OF_MONTH), 2, '0', sb).append(" ");
      append(gstat.get(Calendar.HOUR_OF_DAY), 2, '0', sb).append(":");
      append(gstat.get(Calendar.MINUTE), 2, '0', sb).append(":");
      append(gstat.get(Calendar.SECOND), 2, '0', sb).append(".");
      append(gstat.get(Calendar.MILLISECOND), 3, '0', sb);
    }
    return sb;
  }

  /**
   * Append an integer to a StringBuilder left padded to a given width.
   *
   * @param i The integer to append
   * @param width The minimum width of the field
   * @param pad The character to pad with on the left
   * @param sb The StringBuilder to append to
   * @return sb for chaining
   */
  public static StringBuilder append(long i, int width, char pad, StringBuilder sb) {
    String s = Long.toString(i);
    for (int j = s.length(); j < width; j++) {
      sb.append(pad);
    }
    return sb.append(s);
  }

  public static StringBuilder clear(StringBuilder sb) {
    synchronized (sb) {
      if (sb.length() > 0) {
        sb.delete(0, sb.length());
      }
    }
    return sb;
  }
}
