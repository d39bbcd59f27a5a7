/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.util;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.StringTokenizer;

/**
 * This class is a minimal logging sink so it can be created solely for the purpose of being
 * passed to the computational classes (ICCS, ICCSParams, MCCC ...) which log through it. If the
 * command line has a "&gt;file" or "&gt;&gt;file" on it the output goes to that file (append mode
 * for "&gt;&gt;"), otherwise it goes to the Util.prt() output preceded by the tag.
 *
 * @author U.S. Geological Survey  &lt;ketchum at usgs.gov&gt;
 */
public final class Logger {

  private final String tag;
  private PrintStream out;
  private String logname;
  private final StringBuilder timescr = new StringBuilder(14);
  private final Object outmutex = new Object();

  /**
   * Create a logger
   *
   * @param argline The command line might just be "&gt;&gt;logfile"
   * @param tag Some tag for identifying the output
   */
  public Logger(String argline, String tag) {
    if (tag.length() > 4) {
      this.tag = tag;
    } else {
      this.tag = (tag + "    ").substring(0, 4);
    }
    String line = argline == null ? "" : argline;
    StringTokenizer tk = new StringTokenizer(line, ">");
    if (line.contains(">") && tk.countTokens() >= 1) {
      if (!line.trim().startsWith(">")) {
        tk.nextToken();         // skip the parameters
      }
      if (tk.hasMoreTokens()) {
        logname = tk.nextToken().trim();
        boolean append = line.contains(">>");
        try {
          out = new PrintStream(new FileOutputStream(logname, append));
          out.println(Util.ascdatetime2(System.currentTimeMillis()) + " % Opening log file " + logname);
        } catch (FileNotFoundException e) {
          Util.prta("Cannot open log file " + logname + " e=" + e);
          out = null;           // emergency, send it to the Util output
        }
      }
    }
  }

  /**
   * Create a logger which writes to the given stream without a file.
   *
   * @param o The stream to use
   * @param tag Some tag for identifying the output
   */
  public Logger(PrintStream o, String tag) {
    this("", tag);
    out = o;
  }

  public String getTag() {
    return tag;
  }

  /**
   * print the string on 1) My local output file if defined, 2) The Util log with tag if not
   *
   * @param s The string to print
   */
  public void prt(CharSequence s) {
    synchronized (outmutex) {
      if (out != null) {
        out.println(s);
      } else {
        Util.prt(new StringBuilder(tag.length() + s.length() + 1).append(tag).append(" ").append(s));
      }
    }
  }

  /**
   * print the string with a time stamp on 1) My local output file if defined, 2) The Util log
   * with tag if not
   *
   * @param s The string to print
   */
  public void prta(CharSequence s) {
    synchronized (outmutex) {
      if (out != null) {
        out.print(Util.asctime2(System.currentTimeMillis(), Util.clear(timescr)).append(" "));
        out.println(s);
      } else {
        Util.prta(new StringBuilder(tag.length() + s.length() + 1).append(tag).append(" ").append(s));
      }
    }
  }

  /**
   * Close the log file if this logger opened one.
   */
  public void close() {
    synchronized (outmutex) {
      if (out != null && logname != null) {
        out.close();
        out = null;
      }
    }
  }
}
