package ca.gc.cra.envbind.infrastructure.source;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a YAML document and flattens it into environment-style keys.
 *
 * <p>Nested mapping keys are joined with {@code _} and upper-cased; {@code -}, {@code .} and spaces
 * in a key become {@code _}. A list of scalars is joined with {@code ,}. A list of mappings becomes
 * indexed keys ({@code servers: [{host: a}]} yields {@code SERVERS_0_HOST=a}). {@code null} becomes
 * the empty string.</p>
 *
 * @since 0.1.0
 */
public final class YamlEnvironmentSource implements EnvironmentSource {
  private final Map<String, String> values;

  private YamlEnvironmentSource(Map<String, String> values) {
    this.values = values;
  }

  /**
   * Loads a YAML file.
   *
   * @param path location of the document
   * @return flattened source, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping
   */
  public static Optional<YamlEnvironmentSource> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses a YAML document from a reader.
   *
   * @param reader document source; not closed
   * @param context name used in error messages
   * @return flattened source
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping
   */
  public static YamlEnvironmentSource parse(Reader reader, String context) {
    Objects.requireNonNull(reader, "reader");
    try {
      Object document = new Yaml().load(reader);
      Map<String, String> flattened = new LinkedHashMap<>();
      if (document != null) {
        flatten(asMap(document, "root"), "", flattened);
      }
      return new YamlEnvironmentSource(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML at " + context, ex);
    }
  }

  @Override
  public Optional<String> lookup(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public Set<String> keys() {
    return values.keySet();
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException(context + " section contains a null key");
      }
      map.put(entry.getKey().toString(), entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String segment = key.trim().replace('-', '_').replace('.', '_').replace(' ', '_')
          .toUpperCase(Locale.ROOT);
      String composite = prefix.isEmpty() ? segment : prefix + '_' + segment;
      put(composite, entry.getValue(), target);
    }
  }

  private static void put(String key, Object value, Map<String, String> target) {
    if (value == null) {
      target.put(key, "");
    } else if (value instanceof Map<?, ?> nested) {
      flatten(asMap(nested, key), key, target);
    } else if (value instanceof List<?> list) {
      putList(key, list, target);
    } else {
      target.put(key, value.toString());
    }
  }

  private static void putList(String key, List<?> list, Map<String, String> target) {
    boolean allMaps = !list.isEmpty() && list.stream().allMatch(item -> item instanceof Map<?, ?>);
    if (allMaps) {
      for (int i = 0; i < list.size(); i++) {
        flatten(asMap(list.get(i), key + '_' + i), key + '_' + i, target);
      }
      return;
    }
    List<String> scalars = new ArrayList<>(list.size());
    for (Object item : list) {
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException(
            "YAML list under " + key + " must hold only scalars or only mappings");
      }
      scalars.add(item == null ? "" : item.toString());
    }
    target.put(key, String.join(",", scalars));
  }
}
