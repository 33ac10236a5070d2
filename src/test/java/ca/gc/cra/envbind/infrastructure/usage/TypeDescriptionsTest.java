package ca.gc.cra.envbind.infrastructure.usage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.envbind.domain.type.TypeCatalog;
import ca.gc.cra.envbind.testutil.SampleConfigs.Color;
import ca.gc.cra.envbind.testutil.SampleConfigs.Level;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TypeDescriptionsTest {
  private final TypeCatalog catalog = new TypeCatalog();

  @SuppressWarnings("unused")
  private static class Holder {
    List<Integer> numbers;
    Map<String, Boolean> flags;
    Optional<Duration> timeout;
    Object anything;
  }

  @Test
  void describesScalars() {
    assertEquals("String", describe(String.class, false));
    assertEquals("Character", describe(char.class, false));
    assertEquals("True or False", describe(Boolean.class, false));
    assertEquals("Integer", describe(long.class, false));
    assertEquals("Unsigned Integer", describe(int.class, true));
    assertEquals("Float", describe(double.class, false));
    assertEquals("Decimal", describe(BigDecimal.class, false));
    assertEquals("Duration", describe(Duration.class, false));
    assertEquals("Bytes", describe(byte[].class, false));
    assertEquals("One of DEBUG, INFO, WARN", describe(Level.class, false));
    assertEquals("Color", describe(Color.class, false));
  }

  @Test
  void describesContainers() throws Exception {
    assertEquals("Comma-separated list of Integer", field("numbers", ','));
    assertEquals("Semicolon-separated list of String:True or False pairs", field("flags", ';'));
    assertEquals("Duration", field("timeout", ','));
    assertEquals("java.lang.Object", field("anything", ','));
  }

  @Test
  void namesSeparators() {
    assertEquals("Bar", TypeDescriptions.separatorName('|'));
    assertEquals("Backslash", TypeDescriptions.separatorName('\\'));
    assertEquals("\"%\"", TypeDescriptions.separatorName('%'));
  }

  private String describe(Class<?> type, boolean unsigned) {
    return TypeDescriptions.describe(catalog.classify(type, unsigned, ','));
  }

  private String field(String name, char separator) throws Exception {
    return TypeDescriptions.describe(catalog.classify(
        Holder.class.getDeclaredField(name).getGenericType(), false, separator));
  }
}
