package ca.gc.cra.envbind.infrastructure.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UsageFormatTest {

  @Test
  void parsesNamesCaseInsensitively() {
    assertEquals(UsageFormat.TABLE, UsageFormat.fromString(null));
    assertEquals(UsageFormat.TABLE, UsageFormat.fromString(" "));
    assertEquals(UsageFormat.LIST, UsageFormat.fromString("List"));
    assertEquals(UsageFormat.JSON, UsageFormat.fromString("json"));
    assertEquals(UsageFormat.CUSTOM, UsageFormat.fromString("CUSTOM"));
  }

  @Test
  void rejectsUnknownFormats() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> UsageFormat.fromString("xml"));

    assertEquals("format must be one of table, list, json, custom; got xml", ex.getMessage());
  }
}
