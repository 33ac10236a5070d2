package ca.gc.cra.envbind.domain.decode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class StringFactoriesTest {

  public static class Label {
    private final String text;

    public Label(String text) {
      this.text = text.trim();
    }
  }

  @Test
  void findsStaticFactories() throws Exception {
    assertEquals(URI.create("http://example.org"), decode(URI.class, "http://example.org"));
    assertEquals(Path.of("/tmp", "app"), decode(Path.class, "/tmp/app"));
    assertEquals(Instant.EPOCH, decode(Instant.class, "1970-01-01T00:00:00Z"));
    assertEquals(LocalDate.of(2024, 1, 31), decode(LocalDate.class, "2024-01-31"));
    UUID id = UUID.randomUUID();
    assertEquals(id, decode(UUID.class, id.toString()));
  }

  @Test
  void fallsBackToStringConstructor() throws Exception {
    Label label = (Label) decode(Label.class, " spaced ");

    assertEquals("spaced", label.text);
  }

  @Test
  void typesWithoutFactoryHaveNone() {
    assertTrue(StringFactories.find(Runnable.class).isEmpty());
    assertTrue(StringFactories.find(Object.class).isEmpty());
    assertTrue(StringFactories.find(int.class).isEmpty());
    assertTrue(StringFactories.find(String[].class).isEmpty());
  }

  @Test
  void factoryExceptionsSurfaceUnwrapped() {
    assertThrows(DateTimeParseException.class, () -> decode(Instant.class, "yesterday"));
    assertThrows(IllegalArgumentException.class, () -> decode(UUID.class, "nope"));
  }

  @Test
  void lookupsAreCached() {
    assertSame(StringFactories.find(URI.class), StringFactories.find(URI.class));
  }

  private static Object decode(Class<?> type, String value) throws Exception {
    return StringFactories.find(type).orElseThrow().decode(value);
  }
}
