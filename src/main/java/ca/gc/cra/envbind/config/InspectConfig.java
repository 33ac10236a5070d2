package ca.gc.cra.envbind.config;

import ca.gc.cra.envbind.infrastructure.usage.UsageFormat;
import ca.gc.cra.envbind.infrastructure.usage.UsageTemplate;
import ca.gc.cra.envbind.validation.Paths;
import ca.gc.cra.envbind.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Options shared by the {@code usage}, {@code check} and {@code unused} commands.
 * <p><strong>Role:</strong> Adapter configuration built from {@code key=value} CLI arguments.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param specClass fully qualified name of the configuration class
 * @param prefix key prefix, possibly empty
 * @param envFile optional {@code KEY=VALUE} file
 * @param yamlFile optional YAML file
 * @param format usage layout
 * @param template per-variable layout, present exactly when {@code format} is {@code CUSTOM}
 * @param includeSystemEnv whether the process environment is the top layer
 * @since 0.1.0
 */
public record InspectConfig(
    String specClass,
    String prefix,
    Optional<Path> envFile,
    Optional<Path> yamlFile,
    UsageFormat format,
    Optional<UsageTemplate> template,
    boolean includeSystemEnv) {

  private static final Set<String> KNOWN_KEYS = Set.of("spec", "prefix", "envFile", "yaml", "format", "template");

  public InspectConfig {
    Objects.requireNonNull(specClass, "specClass");
    prefix = prefix == null ? "" : prefix;
    envFile = Objects.requireNonNullElse(envFile, Optional.empty());
    yamlFile = Objects.requireNonNullElse(yamlFile, Optional.empty());
    format = Objects.requireNonNullElse(format, UsageFormat.TABLE);
    template = Objects.requireNonNullElse(template, Optional.empty());
    if (format == UsageFormat.CUSTOM && template.isEmpty()) {
      throw new IllegalArgumentException("format=custom requires template");
    }
    if (format != UsageFormat.CUSTOM && template.isPresent()) {
      throw new IllegalArgumentException("template only applies to format=custom");
    }
  }

  /**
   * Builds options from parsed {@code key=value} arguments.
   *
   * @param args argument map; must not be {@code null}
   * @param includeSystemEnv whether the process environment is layered on top
   * @return validated options
   * <p>A {@code template} without {@code format} selects {@code CUSTOM}.</p>
   *
   * @throws IllegalArgumentException when {@code spec} is missing, a key is unknown, a file is unreadable
   *     or the template does not match the format
   */
  public static InspectConfig fromMap(Map<String, String> args, boolean includeSystemEnv) {
    Objects.requireNonNull(args, "args");
    for (String key : args.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
    }
    String spec = args.get("spec");
    if (spec == null) {
      throw new IllegalArgumentException("spec is required");
    }
    String rawTemplate = args.get("template");
    Optional<UsageTemplate> template = rawTemplate == null
        ? Optional.empty()
        : Optional.of(UsageTemplate.compile(rawTemplate));
    String rawFormat = args.get("format");
    UsageFormat format = template.isPresent() && (rawFormat == null || rawFormat.isBlank())
        ? UsageFormat.CUSTOM
        : UsageFormat.fromString(rawFormat);
    return new InspectConfig(
        Strings.requireClassName("spec", spec),
        Strings.sanitizePrefix("prefix", args.get("prefix")),
        readableFile("envFile", args.get("envFile")),
        readableFile("yaml", args.get("yaml")),
        format,
        template,
        includeSystemEnv);
  }

  private static Optional<Path> readableFile(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Paths.requireReadableFile(name, Path.of(value.trim())));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
