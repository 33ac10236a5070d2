package ca.gc.cra.envbind.application.coerce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationLiteralsTest {

  @Test
  void parsesUnitSequences() {
    assertEquals(Duration.ofMillis(300), DurationLiterals.parse("300ms"));
    assertEquals(Duration.ofMinutes(90), DurationLiterals.parse("1.5h"));
    assertEquals(Duration.ofHours(2).plusMinutes(45), DurationLiterals.parse("2h45m"));
    assertEquals(Duration.ofMinutes(-3), DurationLiterals.parse("-3m"));
    assertEquals(Duration.ofNanos(1500), DurationLiterals.parse("1.5µs"));
    assertEquals(Duration.ofNanos(2000), DurationLiterals.parse("2us"));
    assertEquals(Duration.ZERO, DurationLiterals.parse("0"));
  }

  @Test
  void acceptsIsoDurations() {
    assertEquals(Duration.ofSeconds(90), DurationLiterals.parse("PT1M30S"));
    assertEquals(Duration.ofHours(-1), DurationLiterals.parse("-PT1H"));
  }

  @Test
  void rejectsMalformedInput() {
    IllegalArgumentException missingUnit =
        assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("10"));
    assertTrue(missingUnit.getMessage().contains("missing unit"));
    IllegalArgumentException unknownUnit =
        assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("10d"));
    assertTrue(unknownUnit.getMessage().contains("unknown unit \"d\""));
    assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse(""));
    assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("-"));
    assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse(".s"));
    assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("PTxyz"));
  }

  @Test
  void rejectsOverflow() {
    assertThrows(IllegalArgumentException.class, () -> DurationLiterals.parse("3000000h"));
  }
}
