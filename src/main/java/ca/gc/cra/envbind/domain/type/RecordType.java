package ca.gc.cra.envbind.domain.type;

import java.util.Objects;

/**
 * Nested configuration class walked field by field.
 *
 * @param rawType nested class
 * @since 0.1.0
 */
public record RecordType(Class<?> rawType) implements TypeDescriptor {
  public RecordType {
    Objects.requireNonNull(rawType, "rawType");
  }
}
