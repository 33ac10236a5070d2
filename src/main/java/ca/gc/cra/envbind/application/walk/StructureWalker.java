package ca.gc.cra.envbind.application.walk;

import ca.gc.cra.envbind.application.coerce.TypeCoercer;
import ca.gc.cra.envbind.application.naming.DerivedKey;
import ca.gc.cra.envbind.application.naming.KeyDeriver;
import ca.gc.cra.envbind.domain.env.EnvironmentSnapshot;
import ca.gc.cra.envbind.domain.failure.InvalidSpecificationException;
import ca.gc.cra.envbind.domain.failure.MalformedSequenceIndexException;
import ca.gc.cra.envbind.domain.type.CollectionKind;
import ca.gc.cra.envbind.domain.type.FieldDescriptor;
import ca.gc.cra.envbind.domain.type.FieldMetadata;
import ca.gc.cra.envbind.domain.type.OptionalType;
import ca.gc.cra.envbind.domain.type.RecordDescriptor;
import ca.gc.cra.envbind.domain.type.RecordType;
import ca.gc.cra.envbind.domain.type.SequenceType;
import ca.gc.cra.envbind.domain.type.TypeCatalog;
import ca.gc.cra.envbind.domain.type.TypeDescriptor;
import java.lang.reflect.Array;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Traverses a configuration object and lists the variables its fields read.
 * <p><strong>Why:</strong> Binding, usage output and unused-key detection all need the same keys; computing
 * them in one traversal keeps the three views consistent.</p>
 * <p><strong>Role:</strong> Application service driven by the {@code EnvConfig} facade.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Visit fields superclass first, in declaration order, skipping ignored fields.</li>
 *   <li>Allocate missing nested objects and descend with the field key as prefix, or the parent
 *   prefix for embedded fields without alias. An {@code Optional} nested field that is {@code null}
 *   or empty is set to a present, freshly allocated object.</li>
 *   <li>Expand lists of nested objects from indexed keys, allocating exactly one element per index.</li>
 *   <li>Reject a nested class that contains itself; lists of the same class are bounded by the keys.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from collaborators; one traversal mutates only the
 * target object graph.</p>
 * <p><strong>Observability:</strong> Logs list expansion at DEBUG; never logs values.</p>
 *
 * @since 0.1.0
 */
public final class StructureWalker {
  private static final Logger log = LoggerFactory.getLogger(StructureWalker.class);

  private final TypeCatalog catalog;
  private final KeyDeriver deriver;
  private final TypeCoercer coercer;
  private final SequenceIndexScanner scanner;

  /**
   * Creates a walker.
   *
   * @param catalog descriptor cache
   * @param deriver key derivation
   * @param coercer conversion rules of the current call, used to tell leaves from nested objects
   */
  public StructureWalker(TypeCatalog catalog, KeyDeriver deriver, TypeCoercer coercer) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.deriver = Objects.requireNonNull(deriver, "deriver");
    this.coercer = Objects.requireNonNull(coercer, "coercer");
    this.scanner = new SequenceIndexScanner();
  }

  /**
   * Gathers the variables of a configuration object.
   *
   * @param prefix root prefix, possibly empty
   * @param target configuration object; nested objects and list elements are allocated in place
   * @param snapshot environment view used to size indexed lists
   * @return variables in traversal order
   * @throws InvalidSpecificationException when the object graph cannot be bound
   * @throws MalformedSequenceIndexException when indexed keys are malformed or have gaps
   */
  public List<VariableInfo> gather(String prefix, Object target, EnvironmentSnapshot snapshot)
      throws InvalidSpecificationException, MalformedSequenceIndexException {
    if (target == null) {
      throw new InvalidSpecificationException("specification must not be null");
    }
    Objects.requireNonNull(snapshot, "snapshot");
    validate(target.getClass(), new ArrayDeque<>(), new ArrayList<>());
    List<VariableInfo> infos = new ArrayList<>();
    Deque<Class<?>> path = new ArrayDeque<>();
    walk(prefix == null ? "" : prefix, target, snapshot, false, path, infos);
    return infos;
  }

  private void validate(Class<?> type, Deque<Class<?>> path, List<Class<?>> checked)
      throws InvalidSpecificationException {
    if (path.contains(type)) {
      throw new InvalidSpecificationException("recursive configuration class " + type.getName());
    }
    if (checked.contains(type)) {
      return;
    }
    RecordDescriptor descriptor = catalog.describe(type);
    path.push(type);
    checked.add(type);
    for (FieldDescriptor field : descriptor.fields()) {
      if (field.metadata().ignored()) {
        continue;
      }
      TypeDescriptor fieldType = field.type();
      RecordType nestedType = nestedRecord(fieldType);
      if (nestedType != null) {
        validate(nestedType.rawType(), path, checked);
      } else if (fieldType instanceof SequenceType sequence && sequence.ofRecords()
          && !coercer.hasDecoder(sequence.element()) && !coercer.hasDecoder(sequence)) {
        validate(sequence.element().rawType(), new ArrayDeque<>(), checked);
      }
    }
    path.pop();
  }

  private void walk(
      String prefix,
      Object target,
      EnvironmentSnapshot snapshot,
      boolean insideSequence,
      Deque<Class<?>> path,
      List<VariableInfo> infos)
      throws InvalidSpecificationException, MalformedSequenceIndexException {
    RecordDescriptor descriptor = catalog.describe(target.getClass());
    if (path.contains(descriptor.type())) {
      throw new InvalidSpecificationException(
          "recursive configuration class " + descriptor.type().getName());
    }
    path.push(descriptor.type());
    for (FieldDescriptor field : descriptor.fields()) {
      FieldMetadata metadata = field.metadata();
      if (metadata.ignored()) {
        continue;
      }
      DerivedKey keys = deriver.derive(
          prefix, field.name(), metadata.splitWords(), metadata.alias(), insideSequence);
      TypeDescriptor type = field.type();
      RecordType nestedType = nestedRecord(type);
      if (nestedType != null) {
        if (path.contains(nestedType.rawType())) {
          throw new InvalidSpecificationException(
              "recursive configuration class " + nestedType.rawType().getName());
        }
        Object nested = presentValue(field.read(target));
        if (nested == null) {
          nested = catalog.describe(nestedType.rawType()).newInstance();
          field.write(target, type instanceof OptionalType ? Optional.of(nested) : nested);
        }
        String innerPrefix = metadata.embedded() && !metadata.hasAlias() ? prefix : keys.key();
        walk(innerPrefix, nested, snapshot, insideSequence, path, infos);
      } else if (type instanceof SequenceType sequence && sequence.ofRecords()
          && !coercer.hasDecoder(sequence.element()) && !coercer.hasDecoder(sequence)) {
        expand(keys, target, field, sequence, snapshot, insideSequence, infos);
      } else {
        VariableKind kind = coercer.canCoerce(type) ? VariableKind.VALUE : VariableKind.OPAQUE;
        infos.add(new VariableInfo(keys, target, field, kind, 0, insideSequence));
      }
    }
    path.pop();
  }

  // A nested class, directly or as Optional<Nested>, that no registered decoder converts.
  private RecordType nestedRecord(TypeDescriptor type) {
    if (coercer.hasDecoder(type)) {
      return null;
    }
    if (type instanceof RecordType record) {
      return record;
    }
    if (type instanceof OptionalType optional && optional.element() instanceof RecordType record
        && !coercer.hasDecoder(record)) {
      return record;
    }
    return null;
  }

  private static Object presentValue(Object current) {
    if (current instanceof Optional<?> optional) {
      return optional.orElse(null);
    }
    return current;
  }

  private void expand(
      DerivedKey keys,
      Object target,
      FieldDescriptor field,
      SequenceType sequence,
      EnvironmentSnapshot snapshot,
      boolean insideSequence,
      List<VariableInfo> infos)
      throws InvalidSpecificationException, MalformedSequenceIndexException {
    String base = keys.key();
    int count = scanner.count(base, snapshot);
    if (count == 0 && keys.hasAlias() && !insideSequence) {
      count = scanner.count(keys.aliasKey(), snapshot);
      if (count > 0) {
        base = keys.aliasKey();
      }
    }
    infos.add(new VariableInfo(keys, target, field, VariableKind.INDEXED_LIST, count, insideSequence));
    if (count == 0) {
      return;
    }
    log.debug("Expanding {} elements under {}", count, base);
    RecordDescriptor element = catalog.describe(sequence.element().rawType());
    List<Object> elements = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      elements.add(element.newInstance());
    }
    field.write(target, materialize(sequence, elements));
    for (int i = 0; i < count; i++) {
      walk(base + "_" + i, elements.get(i), snapshot, true, new ArrayDeque<>(), infos);
    }
  }

  private static Object materialize(SequenceType sequence, List<Object> elements) {
    if (sequence.collectionKind() == CollectionKind.ARRAY) {
      Object array = Array.newInstance(sequence.element().rawType(), elements.size());
      for (int i = 0; i < elements.size(); i++) {
        Array.set(array, i, elements.get(i));
      }
      return array;
    }
    return elements;
  }
}
