package ca.gc.cra.envbind.domain.type;

import java.util.Objects;

/**
 * Delimited list of elements, or an indexed list of nested objects when the element is a
 * {@link RecordType}.
 *
 * @param element element descriptor
 * @param collectionKind container to materialize
 * @param rawType declared container type
 * @param separator element separator
 * @since 0.1.0
 */
public record SequenceType(
    TypeDescriptor element, CollectionKind collectionKind, Class<?> rawType, char separator)
    implements TypeDescriptor {
  public SequenceType {
    Objects.requireNonNull(element, "element");
    Objects.requireNonNull(collectionKind, "collectionKind");
    Objects.requireNonNull(rawType, "rawType");
  }

  /**
   * Indicates a list or array of nested configuration objects, expanded from indexed keys unless a
   * decoder is registered for the element class.
   *
   * @return {@code true} when the element is a nested class held in a list or an array
   */
  public boolean ofRecords() {
    return element instanceof RecordType
        && (collectionKind == CollectionKind.LIST || collectionKind == CollectionKind.ARRAY);
  }
}
