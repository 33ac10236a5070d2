package ca.gc.cra.envbind.infrastructure.source;

import ca.gc.cra.envbind.application.port.EnvironmentSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link EnvironmentSource} over an in-memory copy of a map. Entries with a {@code null} key or
 * value are dropped.
 *
 * @since 0.1.0
 */
public final class MapEnvironmentSource implements EnvironmentSource {
  private final Map<String, String> values;

  /**
   * Copies the given pairs.
   *
   * @param values key/value pairs; must not be {@code null}
   */
  public MapEnvironmentSource(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> copy = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    this.values = Map.copyOf(copy);
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

  /**
   * Returns the backing pairs.
   *
   * @return immutable map
   */
  public Map<String, String> asMap() {
    return values;
  }
}
