/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.seis.EmptySelectionException;
import gov.usgs.iccs.seis.MiniSeismogram;
import gov.usgs.iccs.util.Logger;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests of the ICCS iteration and its cached state.
 */
class ICCSTest {

  private static final double DT = 0.01;
  private static final int NSAMP = 1000;
  private static final long TRUE_PICK = Synthetics.T0 + 5000;
  private static final int NOISY = 9;
  private static final int FLIPPED = 6;

  private ByteArrayOutputStream out;
  private Logger log;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    log = new Logger(new PrintStream(out, true), "TEST");
  }

  private static ICCSParams params(String extra) {
    return new ICCSParams("-pre -2.5 -post 2.5 -ctx 2 -rampfrac 0.1 -limit 0.001 " + extra, null);
  }

  private static MiniICCSSeismogram burst(long pick, long seed) {
    double[] d = Synthetics.add(Synthetics.burst(NSAMP, DT, 5., 2., 0.2), Synthetics.noise(NSAMP, 0.05, seed));
    return new MiniICCSSeismogram(Synthetics.T0, DT, d, pick);
  }

  /**
   * Six seismograms picked near the burst, one with reversed polarity, one picked 2 s early, one
   * picked 2 s late and one of only noise.
   */
  private static List<MiniICCSSeismogram> scenario() {
    List<MiniICCSSeismogram> list = new ArrayList<>();
    long[] jitter = {30, -30, 20, -20, 0, 0};
    for (int i = 0; i < jitter.length; i++) {
      list.add(burst(TRUE_PICK + jitter[i], 100 + i));
    }
    MiniICCSSeismogram flipped = burst(TRUE_PICK, 200);
    flipped.setData(Synthetics.negate(flipped.getData()));
    list.add(flipped);
    list.add(burst(TRUE_PICK - 2000, 300));
    list.add(burst(TRUE_PICK + 2000, 400));
    list.add(new MiniICCSSeismogram(Synthetics.T0, DT, Synthetics.noise(NSAMP, 0.5, 500), TRUE_PICK));
    return list;
  }

  private static List<MiniICCSSeismogram> aligned(int n) {
    List<MiniICCSSeismogram> list = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      list.add(burst(TRUE_PICK, 10 + i));
    }
    return list;
  }

  private static void assertAligned(List<MiniICCSSeismogram> list) {
    for (int i = 0; i < list.size(); i++) {
      if (i == NOISY) {
        continue;
      }
      assertEquals(TRUE_PICK, list.get(i).getPick(), 10, "seismogram " + i);
    }
  }

  @Test
  void testEndToEnd() {
    List<MiniICCSSeismogram> list = scenario();
    ICCS iccs = new ICCS(list, params(""), null, log);
    List<Double> history = iccs.run();
    assertFalse(history.isEmpty());
    assertTrue(history.size() <= 10);
    assertEquals(ICCS.RunState.CONVERGED, iccs.getState());
    assertTrue(history.get(history.size() - 1) <= 0.001);

    assertFalse(list.get(NOISY).isSelect());
    assertTrue(list.get(FLIPPED).isFlip());
    for (int i = 0; i < NOISY; i++) {
      assertTrue(list.get(i).isSelect(), "seismogram " + i);
      if (i != FLIPPED) {
        assertFalse(list.get(i).isFlip(), "seismogram " + i);
      }
    }
    assertAligned(list);
    assertTrue(out.toString().contains("converged"));

    double[] ccnorms = iccs.getCcnorms();
    assertEquals(list.size(), ccnorms.length);
    for (int i = 0; i < NOISY; i++) {
      assertTrue(ccnorms[i] > 0.8, "ccnorm " + i + "=" + ccnorms[i]);
    }
  }

  @Test
  void testFourSignalScenario() {
    // one of each: reversed polarity, picked 2 s early, picked 2 s late, only noise
    List<MiniICCSSeismogram> list = new ArrayList<>();
    MiniICCSSeismogram flipped = burst(TRUE_PICK, 200);
    flipped.setData(Synthetics.negate(flipped.getData()));
    list.add(flipped);
    list.add(burst(TRUE_PICK - 2000, 300));
    list.add(burst(TRUE_PICK + 2000, 400));
    list.add(new MiniICCSSeismogram(Synthetics.T0, DT, Synthetics.noise(NSAMP, 0.5, 500), TRUE_PICK));
    ICCS iccs = new ICCS(list, new ICCSParams("-pre -2.5 -post 2.5", null), null, log);
    List<Double> history = iccs.run();
    assertFalse(history.isEmpty());
    assertNotEquals(ICCS.RunState.IDLE, iccs.getState());

    assertFalse(list.get(3).isSelect());
    assertTrue(list.get(0).isFlip());
    assertTrue(list.get(0).isSelect());
    assertTrue(list.get(1).isSelect());
    assertTrue(list.get(2).isSelect());
    // the burst sits at the same place relative to each of the three picks
    long pick0 = list.get(0).getPick();
    assertEquals(pick0, list.get(1).getPick(), 10);
    assertEquals(pick0, list.get(2).getPick(), 10);
  }

  @Test
  void testNoisyConvergenceDoesNotIncrease() {
    List<MiniICCSSeismogram> list = new ArrayList<>();
    long[] jitter = {40, -40, 0, 20, -20, 10};
    for (int i = 0; i < jitter.length; i++) {
      list.add(burst(TRUE_PICK + jitter[i], 600 + i));
    }
    ICCS iccs = new ICCS(list, new ICCSParams("-pre -2.5 -post 2.5", null), null, log);
    List<Double> history = iccs.run();
    assertFalse(history.isEmpty());
    assertTrue(history.size() <= 10);
    for (int i = 2; i < history.size(); i++) {
      assertTrue(history.get(i) <= history.get(i - 1) + 1.e-12, "iteration " + (i + 1) + " " + history);
    }
    for (int i = 1; i < list.size(); i++) {
      assertEquals(list.get(0).getPick(), list.get(i).getPick(), 10, "seismogram " + i);
    }
  }

  @Test
  void testParallelAgreesWithSerial() {
    List<MiniICCSSeismogram> serial = scenario();
    List<MiniICCSSeismogram> parallel = scenario();
    new ICCS(serial, params(""), null, log).run();
    ICCS iccs = new ICCS(parallel, params("-parallel"), null, log);
    iccs.run();
    assertAligned(parallel);
    for (int i = 0; i < NOISY; i++) {
      assertEquals(serial.get(i).getPick(), parallel.get(i).getPick(), 10, "seismogram " + i);
      assertEquals(serial.get(i).isFlip(), parallel.get(i).isFlip());
      assertEquals(serial.get(i).isSelect(), parallel.get(i).isSelect());
    }
  }

  @Test
  void testMaxShift() {
    List<MiniICCSSeismogram> list = aligned(5);
    list.get(1).setT1(TRUE_PICK + 150);
    list.get(2).setT1(TRUE_PICK - 100);
    ICCS iccs = new ICCS(list, params("-maxshift 0.5"), null, log);
    iccs.run();
    for (MiniICCSSeismogram s : list) {
      assertEquals(TRUE_PICK, s.getPick(), 40);
    }
    assertEquals(list.get(0).getPick(), list.get(1).getPick(), 10);
    assertEquals(list.get(0).getPick(), list.get(2).getPick(), 10);
  }

  @Test
  void testUnreachablePick() {
    List<MiniICCSSeismogram> list = aligned(6);
    // burst 2 s before this pick would need a pick at 3.0 s, the window needs at least 2.5 s of data
    double[] d = Synthetics.add(Synthetics.burst(NSAMP, DT, 0.6, 2., 0.2), Synthetics.noise(NSAMP, 0.05, 77));
    MiniICCSSeismogram early = new MiniICCSSeismogram(Synthetics.T0, DT, d, Synthetics.T0 + 2600);
    list.add(early);
    ICCS iccs = new ICCS(list, params("-noselect"), null, log);
    iccs.run();
    List<ICCSWarning> warnings = iccs.getWarnings();
    assertFalse(warnings.isEmpty());
    assertEquals(6, warnings.get(0).getIndex());
    assertEquals(1, warnings.get(0).getIteration());
    assertEquals(Synthetics.T0 + 600, warnings.get(0).getCandidate(), 10);
    assertEquals(Synthetics.T0 + 2500, warnings.get(0).getEarliest());
    assertEquals(Synthetics.T0 + 2600, early.getPick());
    assertTrue(out.toString().contains("UnreachablePick"));
  }

  @Test
  void testCachedUntilChanged() {
    List<MiniICCSSeismogram> list = aligned(4);
    ICCS iccs = new ICCS(list, params(""), null, log);
    MiniSeismogram stack = iccs.stack();
    List<MiniSeismogram> cc = iccs.ccCopies();
    assertSame(stack, iccs.stack());
    assertSame(cc, iccs.ccCopies());
    assertSame(iccs.contextStack(), iccs.contextStack());

    // direct writes to the seismograms are noticed
    list.get(0).setSelect(false);
    assertNotSame(stack, iccs.stack());
    stack = iccs.stack();
    list.get(1).setT1(TRUE_PICK + 100);
    assertNotSame(cc, iccs.ccCopies());
    cc = iccs.ccCopies();
    assertEquals(Synthetics.T0 + 5100 - 3000, cc.get(1).getBeginTime());
    list.get(2).setFlip(true);
    assertNotSame(cc, iccs.ccCopies());

    // setting a parameter to the same value keeps the cache, a new value clears it
    stack = iccs.stack();
    iccs.setMinCcnorm(0.5);
    assertSame(stack, iccs.stack());
    iccs.setMinCcnorm(0.6);
    assertNotSame(stack, iccs.stack());
    stack = iccs.stack();
    iccs.setContextWidth(3.);
    iccs.setRampWidth(0.2, false);
    assertNotSame(stack, iccs.stack());
    assertEquals(2 * 250 + 2 * 20 + 1, iccs.getCcSeismograms().get(0).getNsamp());
  }

  @Test
  void testReturnedCopiesDoNotChangeCache() {
    ICCS iccs = new ICCS(aligned(3), params(""), null, log);
    MiniSeismogram stack = iccs.getStack();
    double[] before = stack.getData().clone();
    stack.getData()[300] = 1000.;
    stack.setBeginTime(0L);
    assertArrayEquals(before, iccs.getStack().getData());
    assertEquals(TRUE_PICK - 3000, iccs.getStack().getBeginTime());

    List<MiniSeismogram> cc = iccs.getCcSeismograms();
    double[] first = cc.get(0).getData().clone();
    cc.get(0).getData()[300] = 1000.;
    assertArrayEquals(first, iccs.getCcSeismograms().get(0).getData());
    assertArrayEquals(before, iccs.getStack().getData());

    List<MiniSeismogram> ctx = iccs.getContextSeismograms();
    double[] ctxFirst = ctx.get(0).getData().clone();
    ctx.get(0).getData()[0] = 1000.;
    iccs.getContextStack().getData()[0] = 1000.;
    assertArrayEquals(ctxFirst, iccs.getContextSeismograms().get(0).getData());
    assertNotEquals(1000., iccs.getContextStack().getData()[0]);
  }

  @Test
  void testContextSeismograms() {
    ICCS iccs = new ICCS(aligned(3), params(""), null, log);
    List<MiniSeismogram> ctx = iccs.getContextSeismograms();
    assertEquals(3, ctx.size());
    // 2.5 s window plus 2 s context each side
    assertEquals(901, ctx.get(0).getNsamp());
    assertEquals(TRUE_PICK - 4500, ctx.get(0).getBeginTime());
    assertEquals(901, iccs.getContextStack().getNsamp());
  }

  @Test
  void testValidators() {
    List<MiniICCSSeismogram> list = aligned(3);
    ICCS iccs = new ICCS(list, params(""), null, log);
    // data 0 to 9.99 s, pick at 5 s, window -2.5 to 2.5
    assertTrue(iccs.validatePick(-2.5));
    assertFalse(iccs.validatePick(-2.6));
    assertTrue(iccs.validatePick(2.49));
    assertFalse(iccs.validatePick(2.5));
    assertTrue(iccs.validateTimeWindow(-2.5, 2.5));
    assertTrue(iccs.validateTimeWindow(-5., 4.99));
    assertFalse(iccs.validateTimeWindow(-5.1, 2.));
    assertFalse(iccs.validateTimeWindow(1., 2.));
    assertFalse(iccs.validateTimeWindow(-2., -1.));
    assertFalse(iccs.validateTimeWindow(2., -2.));

    // a deselected seismogram does not limit the range
    list.get(0).setT1(TRUE_PICK + 2000);
    assertFalse(iccs.validatePick(1.));
    list.get(0).setSelect(false);
    assertTrue(iccs.validatePick(1.));

    for (MiniICCSSeismogram s : list) {
      s.setSelect(false);
    }
    assertTrue(iccs.validatePick(100.));
    assertTrue(iccs.validateTimeWindow(-100., 100.));
    assertThrows(EmptySelectionException.class, iccs::getStack);
    assertThrows(EmptySelectionException.class, iccs::run);
  }

  @Test
  void testWindowSetters() {
    ICCS iccs = new ICCS(aligned(3), params(""), null, log);
    MiniSeismogram stack = iccs.stack();
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPre(-6.));
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPre(1.));
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPost(5.5));
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPost(-3.));
    assertThrows(ICCSParameterException.class, () -> iccs.setTimeWindow(-1., -0.5));
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPre(Double.NaN));
    assertThrows(ICCSParameterException.class, () -> iccs.setWindowPost(Double.NaN));
    assertThrows(ICCSParameterException.class, () -> iccs.setTimeWindow(Double.NaN, 1.));
    assertEquals(-2.5, iccs.getWindowPre());
    assertEquals(2.5, iccs.getWindowPost());
    assertSame(stack, iccs.stack());

    iccs.setWindowPre(-2.);
    assertEquals(-2., iccs.getWindowPre());
    iccs.setWindowPost(3.);
    assertEquals(3., iccs.getWindowPost());
    iccs.setTimeWindow(-1., 1.);
    assertEquals(-1., iccs.getWindowPre());
    assertEquals(1., iccs.getWindowPost());
    // 2 s window plus 0.2 s ramp each side
    assertEquals(241, iccs.getStack().getNsamp());
  }

  @Test
  void testConstructorChecksWindow() {
    List<MiniICCSSeismogram> list = aligned(2);
    list.get(1).setT1(Synthetics.T0 + 1000);
    assertThrows(ICCSParameterException.class, () -> new ICCS(list, params(""), null, log));
    list.get(1).setSelect(false);
    assertNotNull(new ICCS(list, params(""), null, log));
  }

  @Test
  void testUpdateAllPicks() {
    List<MiniICCSSeismogram> list = aligned(3);
    ICCS iccs = new ICCS(list, params(""), null, log);
    MiniSeismogram stack = iccs.stack();
    iccs.updateAllPicks(1.);
    for (MiniICCSSeismogram s : list) {
      assertEquals(Long.valueOf(TRUE_PICK + 1000), s.getT1());
    }
    assertNotSame(stack, iccs.stack());
    assertThrows(ICCSParameterException.class, () -> iccs.updateAllPicks(2.));
    for (MiniICCSSeismogram s : list) {
      assertEquals(TRUE_PICK + 1000, s.getPick());
    }
  }

  @Test
  void testBandpassSetters() {
    ICCS iccs = new ICCS(aligned(3), params(""), null, log);
    MiniSeismogram stack = iccs.stack();
    iccs.setBandpass(0.5, 8.);
    assertNotSame(stack, iccs.stack());
    stack = iccs.stack();
    iccs.setBandpassApply(true);
    assertTrue(iccs.isBandpassApply());
    assertNotSame(stack, iccs.stack());
    assertThrows(ICCSParameterException.class, () -> iccs.setBandpass(3., 1.));
    assertEquals(8., iccs.getParams().getBandpassFmax());
  }

  @Test
  void testChangeMethodConverges() {
    List<MiniICCSSeismogram> list = aligned(5);
    list.get(3).setT1(TRUE_PICK + 50);
    ICCS iccs = new ICCS(list, params("-method change -limit 0.001"), null, log);
    List<Double> history = iccs.run();
    assertEquals(ICCS.RunState.CONVERGED, iccs.getState());
    assertEquals(0., history.get(history.size() - 1), 1.e-3);
    assertEquals(list.get(0).getPick(), list.get(3).getPick(), 10);
  }

  @Test
  void testNoiseFreeConverges() {
    List<MiniICCSSeismogram> list = new ArrayList<>();
    long[] jitter = {40, -40, 0, 20, -20};
    for (long j : jitter) {
      list.add(new MiniICCSSeismogram(Synthetics.T0, DT, Synthetics.burst(NSAMP, DT, 5., 2., 0.2), TRUE_PICK + j));
    }
    ICCS iccs = new ICCS(list, new ICCSParams("-pre -2.5 -post 2.5", null), null, log);
    List<Double> history = iccs.run();
    assertEquals(ICCS.RunState.CONVERGED, iccs.getState());
    assertTrue(history.size() < 10);
    for (int i = 2; i < history.size(); i++) {
      assertTrue(history.get(i) <= history.get(i - 1) + 1.e-12, "iteration " + i);
    }
    for (MiniICCSSeismogram s : list) {
      assertEquals(TRUE_PICK, s.getPick(), 10);
    }
  }

  @Test
  void testMaxIterations() {
    ICCS iccs = new ICCS(scenario(), params(""), null, log);
    List<Double> history = iccs.run(true, true, 0., ConvergenceMethod.CHANGE, 1, null, false);
    assertEquals(1, history.size());
    assertEquals(ICCS.RunState.MAX_ITERATIONS, iccs.getState());
    assertThrows(ICCSParameterException.class,
            () -> iccs.run(true, true, 0.1, ConvergenceMethod.CHANGE, 0, null, false));
  }
}
