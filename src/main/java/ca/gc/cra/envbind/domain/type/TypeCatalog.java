package ca.gc.cra.envbind.domain.type;

import ca.gc.cra.envbind.domain.decode.BinaryUnmarshaler;
import ca.gc.cra.envbind.domain.decode.EnvDecoder;
import ca.gc.cra.envbind.domain.decode.Setter;
import ca.gc.cra.envbind.domain.decode.StringFactories;
import ca.gc.cra.envbind.domain.decode.TextUnmarshaler;
import ca.gc.cra.envbind.domain.failure.InvalidSpecificationException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Builds {@link RecordDescriptor}s and {@link TypeDescriptor}s from configuration
 * classes through reflection.
 * <p><strong>Why:</strong> Classification of every field happens once per class; traversals then dispatch
 * over the closed descriptor set.</p>
 * <p><strong>Role:</strong> Domain service used by the structure walker.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject targets that cannot be populated in place (records, enums, arrays, JDK types).</li>
 *   <li>Collect bindable fields, superclass first, skipping static, final and synthetic fields.</li>
 *   <li>Classify each field type into a descriptor variant; containers keep opaque elements so a
 *   registered decoder can still convert them.</li>
 *   <li>Treat value classes with a one-string factory ({@code URI}, {@code Path}, {@code Instant},
 *   {@code UUID}) as decodable rather than opaque.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Descriptors are cached in a {@link ConcurrentHashMap}; safe to share.</p>
 * <p><strong>Performance:</strong> Reflection cost is paid on the first describe of a class.</p>
 *
 * @since 0.1.0
 */
public final class TypeCatalog {
  private static final Set<Class<?>> LIST_TYPES =
      Set.of(List.class, Collection.class, ArrayList.class);
  private static final Set<Class<?>> SET_TYPES =
      Set.of(Set.class, HashSet.class, LinkedHashSet.class);
  private static final Set<Class<?>> SORTED_SET_TYPES =
      Set.of(SortedSet.class, NavigableSet.class, TreeSet.class);
  private static final Set<Class<?>> MAP_TYPES =
      Set.of(Map.class, HashMap.class, LinkedHashMap.class);
  private static final Set<Class<?>> SORTED_MAP_TYPES =
      Set.of(SortedMap.class, NavigableMap.class, TreeMap.class);

  private final ConcurrentMap<Class<?>, RecordDescriptor> cache = new ConcurrentHashMap<>();

  /**
   * Describes a configuration class.
   *
   * @param type class to describe
   * @return cached or freshly built descriptor
   * @throws InvalidSpecificationException when the class cannot be bound in place
   */
  public RecordDescriptor describe(Class<?> type) throws InvalidSpecificationException {
    Objects.requireNonNull(type, "type");
    RecordDescriptor cached = cache.get(type);
    if (cached != null) {
      return cached;
    }
    RecordDescriptor built = build(type);
    RecordDescriptor raced = cache.putIfAbsent(type, built);
    return raced == null ? built : raced;
  }

  /**
   * Classifies a declared field type.
   *
   * @param type generic field type
   * @param unsigned whether integral leaves parse as unsigned
   * @param separator list and map separator
   * @return descriptor variant
   */
  public TypeDescriptor classify(Type type, boolean unsigned, char separator) {
    if (type instanceof Class<?> cls) {
      return classifyClass(cls, unsigned, separator);
    }
    if (type instanceof ParameterizedType parameterized
        && parameterized.getRawType() instanceof Class<?> raw) {
      return classifyParameterized(parameterized, raw, unsigned, separator);
    }
    return new OpaqueType(type, Object.class);
  }

  private RecordDescriptor build(Class<?> type) throws InvalidSpecificationException {
    if (!isBindableClass(type)) {
      throw new InvalidSpecificationException(
          "specification must be a mutable configuration class, got " + type.getName());
    }
    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> current = type; current != null && current != Object.class && !isJdkType(current);
        current = current.getSuperclass()) {
      hierarchy.push(current);
    }
    List<FieldDescriptor> fields = new ArrayList<>();
    for (Class<?> declaring : hierarchy) {
      for (Field field : declaring.getDeclaredFields()) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || field.isSynthetic()) {
          continue;
        }
        fields.add(describeField(type, field));
      }
    }
    return new RecordDescriptor(type, fields);
  }

  private FieldDescriptor describeField(Class<?> owner, Field field)
      throws InvalidSpecificationException {
    FieldMetadata metadata;
    try {
      metadata = FieldMetadata.of(field);
    } catch (IllegalArgumentException ex) {
      throw new InvalidSpecificationException(ex.getMessage(), ex);
    }
    try {
      field.setAccessible(true);
    } catch (RuntimeException ex) {
      throw new InvalidSpecificationException(
          "field " + field.getName() + " of " + owner.getName() + " is not accessible", ex);
    }
    TypeDescriptor descriptor =
        classify(field.getGenericType(), metadata.unsigned(), metadata.separator());
    return new FieldDescriptor(field.getName(), field, descriptor, metadata);
  }

  private TypeDescriptor classifyClass(Class<?> cls, boolean unsigned, char separator) {
    if (cls.isPrimitive()) {
      return primitive(cls, unsigned);
    }
    if (cls == byte[].class) {
      return new ScalarType(ScalarKind.BYTES, cls);
    }
    if (cls.isArray()) {
      TypeDescriptor element = classify(cls.getComponentType(), unsigned, separator);
      return new SequenceType(element, CollectionKind.ARRAY, cls, separator);
    }
    Optional<DecodeCapability> capability = capabilityOf(cls);
    if (capability.isPresent()) {
      return new DecodableType(cls, capability.get());
    }
    ScalarKind boxed = boxed(cls, unsigned);
    if (boxed != null) {
      return new ScalarType(boxed, cls);
    }
    if (cls.isEnum()) {
      return new ScalarType(ScalarKind.ENUM, cls);
    }
    if (isBindableClass(cls)) {
      return new RecordType(cls);
    }
    if (StringFactories.find(cls).isPresent()) {
      return new DecodableType(cls, DecodeCapability.PARSE);
    }
    return new OpaqueType(cls, cls);
  }

  private TypeDescriptor classifyParameterized(
      ParameterizedType type, Class<?> raw, boolean unsigned, char separator) {
    Type[] args = type.getActualTypeArguments();
    if (raw == Optional.class) {
      return new OptionalType(classify(args[0], unsigned, separator));
    }
    CollectionKind kind = LIST_TYPES.contains(raw) ? CollectionKind.LIST
        : SET_TYPES.contains(raw) ? CollectionKind.SET
        : SORTED_SET_TYPES.contains(raw) ? CollectionKind.SORTED_SET
        : null;
    if (kind != null) {
      return new SequenceType(classify(args[0], unsigned, separator), kind, raw, separator);
    }
    boolean sorted = SORTED_MAP_TYPES.contains(raw);
    if (sorted || MAP_TYPES.contains(raw)) {
      TypeDescriptor key = classify(args[0], unsigned, separator);
      TypeDescriptor value = classify(args[1], unsigned, separator);
      return new MapType(key, value, raw, sorted, separator);
    }
    TypeDescriptor erased = classifyClass(raw, unsigned, separator);
    return erased instanceof OpaqueType ? new OpaqueType(type, raw) : erased;
  }

  private static Optional<DecodeCapability> capabilityOf(Class<?> cls) {
    if (EnvDecoder.class.isAssignableFrom(cls)) {
      return Optional.of(DecodeCapability.DECODER);
    }
    if (Setter.class.isAssignableFrom(cls)) {
      return Optional.of(DecodeCapability.SETTER);
    }
    if (TextUnmarshaler.class.isAssignableFrom(cls)) {
      return Optional.of(DecodeCapability.TEXT);
    }
    if (BinaryUnmarshaler.class.isAssignableFrom(cls)) {
      return Optional.of(DecodeCapability.BINARY);
    }
    return Optional.empty();
  }

  private static TypeDescriptor primitive(Class<?> cls, boolean unsigned) {
    ScalarKind kind = boxed(cls, unsigned);
    return kind == null ? new OpaqueType(cls, cls) : new ScalarType(kind, cls);
  }

  private static ScalarKind boxed(Class<?> cls, boolean unsigned) {
    if (cls == String.class || cls == CharSequence.class) {
      return ScalarKind.STRING;
    }
    if (cls == boolean.class || cls == Boolean.class) {
      return ScalarKind.BOOL;
    }
    if (cls == char.class || cls == Character.class) {
      return ScalarKind.CHAR;
    }
    if (cls == byte.class || cls == Byte.class) {
      return unsigned ? ScalarKind.UINT8 : ScalarKind.INT8;
    }
    if (cls == short.class || cls == Short.class) {
      return unsigned ? ScalarKind.UINT16 : ScalarKind.INT16;
    }
    if (cls == int.class || cls == Integer.class) {
      return unsigned ? ScalarKind.UINT32 : ScalarKind.INT32;
    }
    if (cls == long.class || cls == Long.class) {
      return unsigned ? ScalarKind.UINT64 : ScalarKind.INT64;
    }
    if (cls == float.class || cls == Float.class) {
      return ScalarKind.FLOAT32;
    }
    if (cls == double.class || cls == Double.class) {
      return ScalarKind.FLOAT64;
    }
    if (cls == BigInteger.class) {
      return ScalarKind.BIG_INTEGER;
    }
    if (cls == BigDecimal.class) {
      return ScalarKind.BIG_DECIMAL;
    }
    if (cls == Duration.class) {
      return ScalarKind.DURATION;
    }
    return null;
  }

  private static boolean isBindableClass(Class<?> cls) {
    if (cls == null || cls == Object.class || cls.isPrimitive() || cls.isArray() || cls.isEnum()
        || cls.isRecord() || cls.isInterface() || cls.isAnnotation()
        || Modifier.isAbstract(cls.getModifiers())) {
      return false;
    }
    return !isJdkType(cls);
  }

  private static boolean isJdkType(Class<?> cls) {
    String name = cls.getName();
    return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
        || name.startsWith("sun.") || name.startsWith("com.sun.");
  }
}
