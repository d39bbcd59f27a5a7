/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.util.Logger;
import gov.usgs.iccs.util.Util;
import gov.usgs.iccs.xcorr.MCCC;
import gov.usgs.iccs.xcorr.MCCCResult;
import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line driver: read seismograms from text files, align them with ICCS, refine the
 * alignment with MCCC and print the resulting picks.
 * <p>
 * Each file starts with a header line "begin_ms delta pick_ms" (begin and pick in epoch millis,
 * delta in seconds) followed by one sample per line.  Blank lines and lines starting with # are
 * ignored.
 * <pre>
 * java -jar iccs.jar [-mccc] [-damp d] [ICCS options] file1 file2 ...
 * </pre>
 *
 * @author benz
 */
public class ICCSMain {

  private ICCSMain() {
  }

  /**
   * Read one seismogram in the text format.
   *
   * @param in The reader, not closed
   * @param name For error messages
   * @return The seismogram with t0 set to the pick
   * @throws IOException if reading fails or the contents are not in the format
   */
  public static MiniICCSSeismogram readSeismogram(Reader in, String name) throws IOException {
    BufferedReader rd = new BufferedReader(in);
    String line;
    String[] header = null;
    double[] data = new double[1000];
    int n = 0;
    int lineno = 0;
    while ((line = rd.readLine()) != null) {
      lineno++;
      line = line.trim();
      if (line.length() == 0 || line.startsWith("#")) {
        continue;
      }
      try {
        if (header == null) {
          header = line.split("\\s+");
          if (header.length < 3) {
            throw new IOException(name + " header must be 'begin_ms delta pick_ms' got " + line);
          }
          continue;
        }
        if (n >= data.length) {
          double[] tmp = new double[data.length * 2];
          System.arraycopy(data, 0, tmp, 0, n);
          data = tmp;
        }
        data[n++] = Double.parseDouble(line);
      } catch (NumberFormatException e) {
        throw new IOException(name + " line " + lineno + " is not a number " + line, e);
      }
    }
    if (header == null || n == 0) {
      throw new IOException(name + " has no header or no data");
    }
    try {
      long begin = Long.parseLong(header[0]);
      double delta = Double.parseDouble(header[1]);
      long pick = Long.parseLong(header[2]);
      double[] d = new double[n];
      System.arraycopy(data, 0, d, 0, n);
      MiniICCSSeismogram s = new MiniICCSSeismogram(begin, delta, d, pick);
      s.getExtra().put("file", name);
      return s;
    } catch (NumberFormatException e) {
      throw new IOException(name + " bad header " + header[0] + " " + header[1] + " " + header[2], e);
    } catch (IllegalArgumentException e) {
      throw new IOException(name + " bad header " + e.getMessage(), e);
    }
  }

  public static MiniICCSSeismogram readSeismogram(String filename) throws IOException {
    try (FileReader in = new FileReader(filename)) {
      return readSeismogram(in, filename);
    }
  }

  /**
   * Print the state of every seismogram.
   *
   * @param iccs The ICCS to report on
   * @param mccc The MCCC result for the aligned copies, may be null
   * @param log Where to print
   */
  public static void report(ICCS iccs, MCCCResult mccc, Logger log) {
    StringBuilder sb = new StringBuilder(100);
    List<? extends ICCSSeismogram> list = iccs.getSeismograms();
    double[] ccnorms = null;
    try {
      ccnorms = iccs.getCcnorms();
    } catch (RuntimeException e) {
      log.prta("ICCSMain: no ccnorms e=" + e);
    }
    for (int i = 0; i < list.size(); i++) {
      ICCSSeismogram s = list.get(i);
      Util.clear(sb);
      Object file = s.getExtra().get("file");
      sb.append(file == null ? "#" + i : file.toString()).append(" t0=");
      Util.ascdatetime2(s.getT0(), sb).append(" pick=");
      Util.ascdatetime2(s.getPick(), sb).append(" flip=").append(s.isFlip()).
              append(" select=").append(s.isSelect());
      if (ccnorms != null) {
        sb.append(" ccnorm=").append(Util.df23(ccnorms[i]));
      }
      if (mccc != null) {
        sb.append(" mccc=").append(Util.df24(mccc.getTimes()[i])).append("+-").
                append(Util.df24(mccc.getErrors()[i]));
      }
      log.prt(sb);
    }
  }

  public static void main(String[] args) {
    if (args.length == 0) {
      Util.prt("Usage: ICCSMain [-mccc][-damp d] [ICCS options] file1 file2 ...\n"
              + " -mccc         Refine the aligned picks with MCCC\n"
              + " -damp d       MCCC damping (def=" + MCCC.DEFAULT_DAMPING + ")\n"
              + " -log file     Write the output to this file\n"
              + ICCSParams.COMMANDLINEHELP);
      return;
    }
    boolean doMccc = false;
    double damping = MCCC.DEFAULT_DAMPING;
    String logfile = null;
    List<String> files = new ArrayList<>(args.length);
    List<String> iccsArgs = new ArrayList<>(args.length);
    for (int i = 0; i < args.length; i++) {
      if (args[i].equalsIgnoreCase("-mccc")) {
        doMccc = true;
      } else if (args[i].equalsIgnoreCase("-damp") && i + 1 < args.length) {
        try {
          damping = Double.parseDouble(args[i + 1]);
        } catch (NumberFormatException e) {
          Util.prta("ICCSMain: -damp value is not a number " + args[i + 1]);
          return;
        }
        if (!(damping >= 0.)) {
          Util.prta("ICCSMain: -damp must not be negative " + args[i + 1]);
          return;
        }
        i++;
      } else if (args[i].equalsIgnoreCase("-log") && i + 1 < args.length) {
        logfile = args[i + 1];
        i++;
      } else if (args[i].startsWith("-") && !args[i].matches("-[0-9.].*")) {
        iccsArgs.add(args[i]);
        // options with a value
        if (i + 1 < args.length && !args[i].equalsIgnoreCase("-noflip") && !args[i].equalsIgnoreCase("-noselect")
                && !args[i].equalsIgnoreCase("-parallel") && !args[i].equalsIgnoreCase("-dbg")) {
          iccsArgs.add(args[i + 1]);
          i++;
        }
      } else {
        files.add(args[i]);
      }
    }
    Logger log = new Logger(logfile == null ? "" : ">" + logfile, "ICCS");
    try {
      ICCSParams params = new ICCSParams(iccsArgs.toArray(new String[iccsArgs.size()]), log);
      log.prta(params.toString());
      List<MiniICCSSeismogram> seismograms = new ArrayList<>(files.size());
      for (String f : files) {
        seismograms.add(readSeismogram(f));
      }
      if (seismograms.size() < 2) {
        log.prta("ICCSMain: need at least 2 seismograms got " + seismograms.size());
        return;
      }
      ICCS iccs = new ICCS(seismograms, params, null, log);
      List<Double> history = iccs.run();
      log.prta("ICCSMain: " + iccs.getState() + " after " + history.size() + " iterations warnings="
              + iccs.getWarnings().size());
      MCCCResult result = null;
      if (doMccc) {
        List<MiniSeismogram> selected = new ArrayList<>(seismograms.size());
        List<MiniSeismogram> cc = iccs.getCcSeismograms();
        for (int i = 0; i < seismograms.size(); i++) {
          if (seismograms.get(i).isSelect()) {
            selected.add(cc.get(i));
          }
        }
        MCCCResult sel = new MCCC(log).mccc(selected, MCCC.DEFAULT_MIN_CC, damping);
        double[] times = new double[seismograms.size()];
        double[] errors = new double[seismograms.size()];
        for (int i = 0, j = 0; i < seismograms.size(); i++) {
          if (seismograms.get(i).isSelect()) {
            times[i] = sel.getTimes()[j];
            errors[i] = sel.getErrors()[j];
            j++;
          }
        }
        result = new MCCCResult(times, errors, sel.getRmse(), sel.getNpairs());
        log.prta("ICCSMain: " + result);
      }
      report(iccs, result, log);
    } catch (IOException e) {
      log.prta("ICCSMain: reading input failed e=" + e);
    } catch (RuntimeException e) {
      log.prta("ICCSMain: failed e=" + e);
      e.printStackTrace(Util.getOutput());
    } finally {
      log.close();
    }
  }
}
