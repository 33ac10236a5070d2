package ca.gc.cra.envbind.domain.type;

/**
 * <strong>What:</strong> Closed set of shapes a configuration field can take.
 * <p><strong>Why:</strong> Type dispatch happens once, when {@link TypeCatalog} reads a class, so the coercer
 * and walker switch over a handful of variants instead of re-inspecting reflection types per value.</p>
 * <p><strong>Role:</strong> Domain model shared by the walker, the coercer and usage rendering.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface TypeDescriptor
    permits ScalarType, OptionalType, SequenceType, MapType, RecordType, DecodableType, OpaqueType {

  /**
   * Returns the erased Java type described by this descriptor.
   *
   * @return raw class; primitives are reported as their primitive class
   */
  Class<?> rawType();
}
