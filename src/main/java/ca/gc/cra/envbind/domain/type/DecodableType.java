package ca.gc.cra.envbind.domain.type;

import java.util.Objects;

/**
 * Type that decodes itself through the strongest capability it implements.
 *
 * @param rawType implementing class
 * @param capability capability used for decoding
 * @since 0.1.0
 */
public record DecodableType(Class<?> rawType, DecodeCapability capability) implements TypeDescriptor {
  public DecodableType {
    Objects.requireNonNull(rawType, "rawType");
    Objects.requireNonNull(capability, "capability");
  }
}
