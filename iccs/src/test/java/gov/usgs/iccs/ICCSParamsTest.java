/*
 * This software is in the public domain because it contains materials 
 * that originally came from the United States Geological Survey, 
 * an agency of the United States Department of Interior. For more 
 * information, see the official USGS copyright policy at 
 * http://www.usgs.gov/visual-id/credit_usgs.html#copyright
 */
package gov.usgs.iccs;

import gov.usgs.iccs.util.Logger;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ICCSParams.
 */
class ICCSParamsTest {

  @Test
  void testDefaults() {
    ICCSParams p = new ICCSParams();
    assertEquals(-15., p.getWindowPre());
    assertEquals(15., p.getWindowPost());
    assertEquals(20., p.getContextWidth());
    assertTrue(p.isRampFraction());
    assertEquals(3., p.getRampSeconds(), 1.e-12);
    assertFalse(p.isBandpassApply());
    assertEquals(0.5, p.getMinCcnorm());
    assertEquals(ConvergenceMethod.CORRCOEF, p.getConvergenceMethod());
    assertEquals(10, p.getMaxIterations());
    assertNull(p.getMaxShift());
    assertTrue(p.isAutoflip());
    assertTrue(p.isAutoselect());
    assertFalse(p.isParallel());
  }

  @Test
  void testArgline() {
    ICCSParams p = new ICCSParams("-pre -2.5 -post 3 -ctx 4 -ramp 0.25 -bp 0.5/5/4 -mincc 0.7 "
            + "-limit 0.001 -method change -maxiter 20 -maxshift 1.5 -noflip -noselect -parallel", null);
    assertEquals(-2.5, p.getWindowPre());
    assertEquals(3., p.getWindowPost());
    assertEquals(4., p.getContextWidth());
    assertFalse(p.isRampFraction());
    assertEquals(0.25, p.getRampSeconds());
    assertTrue(p.isBandpassApply());
    assertEquals(0.5, p.getBandpassFmin());
    assertEquals(5., p.getBandpassFmax());
    assertEquals(4, p.getBandpassCorners());
    assertEquals(0.7, p.getMinCcnorm());
    assertEquals(0.001, p.getConvergenceLimit());
    assertEquals(ConvergenceMethod.CHANGE, p.getConvergenceMethod());
    assertEquals(20, p.getMaxIterations());
    assertEquals(Double.valueOf(1.5), p.getMaxShift());
    assertFalse(p.isAutoflip());
    assertFalse(p.isAutoselect());
    assertTrue(p.isParallel());

    ICCSParams copy = new ICCSParams(p);
    assertEquals(p.toString(), copy.toString());
    assertTrue(p.toString().contains("-method change"));
  }

  @Test
  void testRampFraction() {
    ICCSParams p = new ICCSParams("-pre -2 -post 3 -rampfrac 0.2", null);
    assertEquals(1., p.getRampSeconds(), 1.e-12);
    p = new ICCSParams("-pre -2 -post 3 -ramp 10%", null);
    assertTrue(p.isRampFraction());
    assertEquals(0.5, p.getRampSeconds(), 1.e-12);
  }

  @Test
  void testUnknownArgumentSkipped() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ICCSParams p = new ICCSParams("-bogus -post 4 file.txt",
            new Logger(new PrintStream(out, true), "TEST"));
    assertEquals(4., p.getWindowPost());
    assertTrue(out.toString().contains("unknown argument skipped -bogus"));
  }

  @Test
  void testRejects() {
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-pre 2", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-post -1", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-mincc 1.5", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-bp 2/1", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-bp 1", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-method fastest", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-maxiter 0", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-maxshift -1", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-pre abc", null));
    assertThrows(ICCSParameterException.class, () -> new ICCSParams("-post", null));
  }

  @Test
  void testRejectedSetterKeepsValue() {
    ICCSParams p = new ICCSParams();
    assertThrows(ICCSParameterException.class, () -> p.setMinCcnorm(-0.1));
    assertEquals(0.5, p.getMinCcnorm());
    assertThrows(ICCSParameterException.class, () -> p.setContextWidth(0.));
    assertEquals(20., p.getContextWidth());
  }
}
