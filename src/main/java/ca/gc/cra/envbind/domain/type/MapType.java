package ca.gc.cra.envbind.domain.type;

import java.util.Objects;

/**
 * Delimited {@code key:value} pairs.
 *
 * @param key key descriptor
 * @param value value descriptor
 * @param rawType declared map type
 * @param sorted whether a {@link java.util.TreeMap} is materialized instead of a
 *     {@link java.util.LinkedHashMap}
 * @param separator pair separator
 * @since 0.1.0
 */
public record MapType(
    TypeDescriptor key, TypeDescriptor value, Class<?> rawType, boolean sorted, char separator)
    implements TypeDescriptor {
  public MapType {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(rawType, "rawType");
  }
}
