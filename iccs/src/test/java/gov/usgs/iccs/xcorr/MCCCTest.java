/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs.xcorr;

import gov.usgs.iccs.Synthetics;
import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.seis.SeisUtil;
import gov.usgs.iccs.util.Logger;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MCCC.
 */
class MCCCTest {

  private static final double DT = 0.01;
  private static final int[] SHIFTS = {0, 10, -15, 30};
  private static final double[] BASE = Synthetics.noise(1000, 1., 11L);

  private MCCC mccc;
  private ByteArrayOutputStream log;

  @BeforeEach
  void setUp() {
    log = new ByteArrayOutputStream();
    mccc = new MCCC(new Logger(new PrintStream(log, true), "TEST"));
  }

  private static List<MiniSeismogram> shifted(int[] shifts) {
    List<MiniSeismogram> list = new ArrayList<>();
    for (int s : shifts) {
      list.add(new MiniSeismogram(Synthetics.T0, DT, SeisUtil.roll(BASE, s)));
    }
    return list;
  }

  private static double sum(double[] d) {
    double s = 0.;
    for (double v : d) {
      s += v;
    }
    return s;
  }

  @Test
  void testKnownShiftsWithoutDamping() {
    MCCCResult r = mccc.mccc(shifted(SHIFTS), 0.5, 0.);
    double[] t = r.getTimes();
    assertEquals(SHIFTS.length, t.length);
    assertEquals(6, r.getNpairs());
    for (int i = 0; i < SHIFTS.length; i++) {
      for (int j = 0; j < SHIFTS.length; j++) {
        assertEquals((SHIFTS[i] - SHIFTS[j]) * DT, t[i] - t[j], 1.e-9);
      }
    }
    assertEquals(0., sum(t), 1.e-9);
    assertEquals(0., r.getRmse(), 1.e-9);
  }

  @Test
  void testKnownShiftsWithDefaultDamping() {
    MCCCResult r = mccc.mccc(shifted(SHIFTS));
    double[] t = r.getTimes();
    for (int i = 0; i < SHIFTS.length; i++) {
      for (int j = 0; j < SHIFTS.length; j++) {
        assertEquals((SHIFTS[i] - SHIFTS[j]) * DT, t[i] - t[j], 0.002);
      }
      assertTrue(r.getErrors()[i] >= 0.);
    }
    assertEquals(0., sum(t), 1.e-6);
  }

  @Test
  void testTooFewSignals() {
    MCCCResult one = mccc.mccc(shifted(new int[]{0}));
    assertArrayEquals(new double[1], one.getTimes());
    assertArrayEquals(new double[1], one.getErrors());
    assertEquals(0., one.getRmse());
    assertEquals(0, mccc.mccc(Collections.<MiniSeismogram>emptyList()).getTimes().length);
  }

  @Test
  void testNoPairAboveThreshold() {
    MCCCResult r = mccc.mccc(shifted(SHIFTS), 1.5, 0.1);
    assertEquals(0, r.getNpairs());
    assertArrayEquals(new double[SHIFTS.length], r.getTimes());
    assertTrue(log.toString().contains("no pairs"));
  }

  @Test
  void testUncorrelatedSignalIsLeftOut() {
    List<MiniSeismogram> list = shifted(new int[]{0, 20, -5});
    list.add(new MiniSeismogram(Synthetics.T0, DT, Synthetics.noise(1000, 1., 99L)));
    MCCCResult r = mccc.mccc(list, 0.5, 0.1);
    assertEquals(3, r.getNpairs());
    double[] t = r.getTimes();
    assertEquals(0.20, t[1] - t[0], 0.002);
    assertEquals(-0.05, t[2] - t[0], 0.002);
  }

  @Test
  void testInconsistentDelaysGiveMisfitAndErrors() {
    double[][] off = {
      {0., 1., 2.},
      {-1., 0., 1.5},
      {-2., -1.5, 0.}};
    double[][] cc = {
      {1., 0.9, 0.8},
      {0.9, 1., 0.7},
      {0.8, 0.7, 1.}};
    MCCCResult r = mccc.solve(new DelayMatrix(off, cc), 0.5, 0.);
    assertTrue(r.getRmse() > 0.);
    for (double e : r.getErrors()) {
      assertTrue(e > 0.);
    }
    assertEquals(0., sum(r.getTimes()), 1.e-9);
    assertThrows(IllegalArgumentException.class, () -> mccc.solve(new DelayMatrix(off, cc), 0.5, -1.));
  }

  @Test
  void testDisconnectedPairsStillSolve() {
    // only the pair 0-1 survives, 2 is tied to nothing
    double[][] off = {
      {0., 0.3, 0.},
      {-0.3, 0., 0.},
      {0., 0., 0.}};
    double[][] cc = {
      {1., 0.95, 0.1},
      {0.95, 1., 0.1},
      {0.1, 0.1, 1.}};
    MCCCResult r = mccc.solve(new DelayMatrix(off, cc), 0.5, 0.);
    assertEquals(1, r.getNpairs());
    assertEquals(0.3, r.getTimes()[1] - r.getTimes()[0], 1.e-9);
    assertEquals(0., sum(r.getTimes()), 1.e-9);
  }
}
