package ca.gc.cra.envbind.application.walk;

import ca.gc.cra.envbind.application.naming.DerivedKey;
import ca.gc.cra.envbind.domain.type.FieldDescriptor;
import ca.gc.cra.envbind.domain.type.FieldMetadata;
import java.util.Objects;

/**
 * One variable discovered by a traversal, with a live reference to the field it populates.
 *
 * <p>Instances belong to a single call; the target reference makes them unsafe to keep.</p>
 *
 * @param keys canonical and alias keys
 * @param target object declaring the field
 * @param field field descriptor
 * @param kind binding treatment
 * @param elementCount number of indexed elements for {@link VariableKind#INDEXED_LIST}, else 0
 * @param insideSequence whether the field belongs to an indexed list element
 * @since 0.1.0
 */
public record VariableInfo(
    DerivedKey keys,
    Object target,
    FieldDescriptor field,
    VariableKind kind,
    int elementCount,
    boolean insideSequence) {
  public VariableInfo {
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(kind, "kind");
  }

  /** @return canonical key */
  public String key() {
    return keys.key();
  }

  /** @return alias key, empty when none applies */
  public String aliasKey() {
    return keys.aliasKey();
  }

  /** @return binding annotations of the field */
  public FieldMetadata metadata() {
    return field.metadata();
  }
}
