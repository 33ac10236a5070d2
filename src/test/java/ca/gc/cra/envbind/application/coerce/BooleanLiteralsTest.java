package ca.gc.cra.envbind.application.coerce;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BooleanLiteralsTest {

  @Test
  void acceptsTheFixedLiteralSet() {
    for (String value : new String[] {"1", "t", "T", "TRUE", "true", "True"}) {
      assertTrue(BooleanLiterals.parse(value), value);
    }
    for (String value : new String[] {"0", "f", "F", "FALSE", "false", "False"}) {
      assertFalse(BooleanLiterals.parse(value), value);
    }
  }

  @Test
  void rejectsEverythingElse() {
    assertThrows(IllegalArgumentException.class, () -> BooleanLiterals.parse("yes"));
    assertThrows(IllegalArgumentException.class, () -> BooleanLiterals.parse("tRUE"));
    assertThrows(IllegalArgumentException.class, () -> BooleanLiterals.parse(""));
  }
}
