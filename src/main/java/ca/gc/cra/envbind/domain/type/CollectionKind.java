package ca.gc.cra.envbind.domain.type;

/**
 * Container materialized for a {@link SequenceType}.
 *
 * @since 0.1.0
 */
public enum CollectionKind {
  /** {@link java.util.ArrayList}. */
  LIST,
  /** {@link java.util.LinkedHashSet}. */
  SET,
  /** {@link java.util.TreeSet}. */
  SORTED_SET,
  /** Java array of the element type. */
  ARRAY
}
