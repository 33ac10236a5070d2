package ca.gc.cra.envbind.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.envbind.infrastructure.usage.UsageFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InspectConfigTest {
  @TempDir Path tempDir;

  @Test
  void appliesDefaults() {
    InspectConfig config = InspectConfig.fromMap(Map.of("spec", "com.example.Config"), true);

    assertEquals("com.example.Config", config.specClass());
    assertEquals("", config.prefix());
    assertTrue(config.envFile().isEmpty());
    assertTrue(config.yamlFile().isEmpty());
    assertEquals(UsageFormat.TABLE, config.format());
    assertTrue(config.template().isEmpty());
    assertTrue(config.includeSystemEnv());
  }

  @Test
  void readsEveryOption() throws Exception {
    Path env = Files.writeString(tempDir.resolve("app.env"), "A=1\n");
    Path yaml = Files.writeString(tempDir.resolve("app.yaml"), "a: 1\n");

    InspectConfig config = InspectConfig.fromMap(Map.of(
        "spec", "com.example.Config",
        "prefix", "myapp",
        "envFile", env.toString(),
        "yaml", yaml.toString(),
        "format", "json"), false);

    assertEquals("myapp", config.prefix());
    assertEquals(env.toAbsolutePath().normalize(), config.envFile().orElseThrow());
    assertEquals(yaml.toAbsolutePath().normalize(), config.yamlFile().orElseThrow());
    assertEquals(UsageFormat.JSON, config.format());
    assertFalse(config.includeSystemEnv());
  }

  @Test
  void templateSelectsCustomFormat() {
    InspectConfig implied = InspectConfig.fromMap(
        Map.of("spec", "a.B", "template", "{key}\\n"), true);
    InspectConfig explicit = InspectConfig.fromMap(
        Map.of("spec", "a.B", "format", "custom", "template", "{key}={type}"), true);

    assertEquals(UsageFormat.CUSTOM, implied.format());
    assertEquals("{key}\\n", implied.template().orElseThrow().pattern());
    assertEquals(UsageFormat.CUSTOM, explicit.format());
  }

  @Test
  void templateAndFormatMustAgree() {
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("spec", "a.B", "format", "custom"), true));
    assertEquals("format=custom requires template", missing.getMessage());

    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(
        Map.of("spec", "a.B", "format", "json", "template", "{key}"), true));
    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(
        Map.of("spec", "a.B", "template", "{nope}"), true));
  }

  @Test
  void specIsRequired() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("prefix", "app"), true));

    assertEquals("spec is required", ex.getMessage());
  }

  @Test
  void unknownArgumentIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("spec", "a.B", "colour", "red"), true));

    assertEquals("unknown argument: colour", ex.getMessage());
  }

  @Test
  void missingFilesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(
        Map.of("spec", "a.B", "envFile", tempDir.resolve("absent.env").toString()), true));
  }

  @Test
  void invalidPrefixIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> InspectConfig.fromMap(Map.of("spec", "a.B", "prefix", "my-app"), true));
  }
}
