package ca.gc.cra.envbind.domain.type;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link Optional} wrapper: the element is converted and then wrapped.
 *
 * @param element wrapped value descriptor
 * @since 0.1.0
 */
public record OptionalType(TypeDescriptor element) implements TypeDescriptor {
  public OptionalType {
    Objects.requireNonNull(element, "element");
  }

  @Override
  public Class<?> rawType() {
    return Optional.class;
  }
}
