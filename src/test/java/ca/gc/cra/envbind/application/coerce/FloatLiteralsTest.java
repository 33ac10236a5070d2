package ca.gc.cra.envbind.application.coerce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FloatLiteralsTest {

  @Test
  void parsesDecimalExponentAndHex() {
    assertEquals(3.5, FloatLiterals.parseDouble("3.5"));
    assertEquals(0.5, FloatLiterals.parseDouble(".5"));
    assertEquals(2.0, FloatLiterals.parseDouble("2."));
    assertEquals(1500.0, FloatLiterals.parseDouble("1.5e3"));
    assertEquals(-0.25, FloatLiterals.parseDouble("-2.5E-1"));
    assertEquals(3.0, FloatLiterals.parseDouble("0x1.8p1"));
    assertEquals(0.5f, FloatLiterals.parseFloat("0.5"));
  }

  @Test
  void parsesSpecialValuesInAnyCase() {
    assertTrue(Double.isNaN(FloatLiterals.parseDouble("NaN")));
    assertEquals(Double.POSITIVE_INFINITY, FloatLiterals.parseDouble("inf"));
    assertEquals(Double.POSITIVE_INFINITY, FloatLiterals.parseDouble("+Infinity"));
    assertEquals(Float.NEGATIVE_INFINITY, FloatLiterals.parseFloat("-INF"));
  }

  @Test
  void rejectsJavaSuffixesAndWhitespace() {
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseDouble("1.0d"));
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseFloat("1.0f"));
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseDouble(" 1.0"));
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseDouble("0x1.8"));
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseDouble(""));
  }

  @Test
  void finiteLiteralOverflowingWidthIsOutOfRange() {
    NumberFormatException ex =
        assertThrows(NumberFormatException.class, () -> FloatLiterals.parseFloat("1e39"));
    assertEquals("parsing \"1e39\": value out of range", ex.getMessage());
    assertThrows(NumberFormatException.class, () -> FloatLiterals.parseDouble("1e309"));
  }
}
