package ca.gc.cra.envbind.domain.type;

import java.util.Objects;

/**
 * Leaf value converted by a built-in rule.
 *
 * @param kind conversion rule
 * @param rawType declared Java type, primitive or boxed
 * @since 0.1.0
 */
public record ScalarType(ScalarKind kind, Class<?> rawType) implements TypeDescriptor {
  public ScalarType {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(rawType, "rawType");
  }
}
