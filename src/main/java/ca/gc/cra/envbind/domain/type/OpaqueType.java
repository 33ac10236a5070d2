package ca.gc.cra.envbind.domain.type;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Type the binder has no rule for. Fields of this shape still get a key but are never written.
 *
 * @param javaType declared generic type
 * @param rawType erased type
 * @since 0.1.0
 */
public record OpaqueType(Type javaType, Class<?> rawType) implements TypeDescriptor {
  public OpaqueType {
    Objects.requireNonNull(javaType, "javaType");
    Objects.requireNonNull(rawType, "rawType");
  }
}
