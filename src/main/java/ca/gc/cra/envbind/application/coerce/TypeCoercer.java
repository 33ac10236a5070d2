package ca.gc.cra.envbind.application.coerce;

import ca.gc.cra.envbind.domain.decode.BinaryUnmarshaler;
import ca.gc.cra.envbind.domain.decode.DecoderRegistry;
import ca.gc.cra.envbind.domain.decode.EnvDecoder;
import ca.gc.cra.envbind.domain.decode.Setter;
import ca.gc.cra.envbind.domain.decode.StringFactories;
import ca.gc.cra.envbind.domain.decode.TextUnmarshaler;
import ca.gc.cra.envbind.domain.decode.ValueDecoder;
import ca.gc.cra.envbind.domain.type.CollectionKind;
import ca.gc.cra.envbind.domain.type.DecodableType;
import ca.gc.cra.envbind.domain.type.DecodeCapability;
import ca.gc.cra.envbind.domain.type.MapType;
import ca.gc.cra.envbind.domain.type.OpaqueType;
import ca.gc.cra.envbind.domain.type.OptionalType;
import ca.gc.cra.envbind.domain.type.RecordType;
import ca.gc.cra.envbind.domain.type.ScalarKind;
import ca.gc.cra.envbind.domain.type.ScalarType;
import ca.gc.cra.envbind.domain.type.SequenceType;
import ca.gc.cra.envbind.domain.type.TypeDescriptor;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Converts resolved strings into values of a {@link TypeDescriptor}.
 * <p><strong>Why:</strong> Dispatches over the closed descriptor set built by the type catalog, so each
 * conversion rule lives in one place.</p>
 * <p><strong>Role:</strong> Final step of a leaf field visit, before the value is written.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Consult the registry before any built-in rule.</li>
 *   <li>Delegate to self-decoding types through their strongest capability.</li>
 *   <li>Split lists and maps on the field separator and recurse into elements.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds a frozen registry snapshot; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class TypeCoercer {
  private final DecoderRegistry registry;

  /**
   * Creates a coercer over a registry; the registry is frozen on construction.
   *
   * @param registry ad hoc decoders
   */
  public TypeCoercer(DecoderRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry").snapshot();
  }

  /**
   * Converts a raw string.
   *
   * @param value raw string, possibly empty
   * @param type target descriptor
   * @return converted value; primitives are boxed
   * @throws CoercionException when the string does not convert
   */
  public Object coerce(String value, TypeDescriptor type) throws CoercionException {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(type, "type");
    Optional<ValueDecoder<?>> decoder = registry.find(type.rawType());
    if (decoder.isPresent()) {
      return invoke(decoder.get(), value);
    }
    if (type instanceof ScalarType scalar) {
      return scalar(value, scalar);
    }
    if (type instanceof OptionalType optional) {
      return Optional.ofNullable(coerce(value, optional.element()));
    }
    if (type instanceof SequenceType sequence) {
      return sequence(value, sequence);
    }
    if (type instanceof MapType map) {
      return map(value, map);
    }
    if (type instanceof DecodableType decodable) {
      return decodable(value, decodable);
    }
    if (type instanceof RecordType record) {
      throw new CoercionException(
          "no decoder registered for nested class " + record.rawType().getSimpleName());
    }
    OpaqueType opaque = (OpaqueType) type;
    throw new CoercionException("unsupported type " + opaque.javaType().getTypeName());
  }

  /**
   * Indicates whether a descriptor converts from a single string, either through a registered
   * decoder or a built-in rule. Nested classes and opaque types without a decoder do not.
   *
   * @param type descriptor
   * @return {@code true} when {@link #coerce(String, TypeDescriptor)} applies
   */
  public boolean canCoerce(TypeDescriptor type) {
    if (registry.find(type.rawType()).isPresent()) {
      return true;
    }
    if (type instanceof OptionalType optional) {
      return canCoerce(optional.element());
    }
    if (type instanceof SequenceType sequence) {
      return canCoerce(sequence.element());
    }
    if (type instanceof MapType map) {
      return canCoerce(map.key()) && canCoerce(map.value());
    }
    return type instanceof ScalarType || type instanceof DecodableType;
  }

  /**
   * Indicates whether a decoder is registered for the raw type of a descriptor.
   *
   * @param type descriptor
   * @return {@code true} when the registry has an exact match
   */
  public boolean hasDecoder(TypeDescriptor type) {
    return registry.find(type.rawType()).isPresent();
  }

  private Object scalar(String value, ScalarType type) throws CoercionException {
    try {
      return switch (type.kind()) {
        case STRING -> value;
        case CHAR -> character(value);
        case BOOL -> BooleanLiterals.parse(value);
        case INT8 -> (byte) IntegerLiterals.parseSigned(value, 8);
        case INT16 -> (short) IntegerLiterals.parseSigned(value, 16);
        case INT32 -> (int) IntegerLiterals.parseSigned(value, 32);
        case INT64 -> IntegerLiterals.parseSigned(value, 64);
        case UINT8 -> (byte) IntegerLiterals.parseUnsigned(value, 8);
        case UINT16 -> (short) IntegerLiterals.parseUnsigned(value, 16);
        case UINT32 -> (int) IntegerLiterals.parseUnsigned(value, 32);
        case UINT64 -> IntegerLiterals.parseUnsigned(value, 64);
        case BIG_INTEGER -> IntegerLiterals.parse(value);
        case FLOAT32 -> FloatLiterals.parseFloat(value);
        case FLOAT64 -> FloatLiterals.parseDouble(value);
        case BIG_DECIMAL -> new BigDecimal(value);
        case DURATION -> DurationLiterals.parse(value);
        case BYTES -> value.getBytes(StandardCharsets.UTF_8);
        case ENUM -> enumConstant(value, type.rawType());
      };
    } catch (IllegalArgumentException ex) {
      throw new CoercionException(ex.getMessage(), ex);
    }
  }

  private static Character character(String value) {
    if (value.length() != 1) {
      throw new IllegalArgumentException("expected exactly one character, got " + value.length());
    }
    return value.charAt(0);
  }

  private static Object enumConstant(String value, Class<?> enumType) {
    Object[] constants = enumType.getEnumConstants();
    for (Object constant : constants) {
      if (((Enum<?>) constant).name().equals(value)) {
        return constant;
      }
    }
    for (Object constant : constants) {
      if (((Enum<?>) constant).name().equalsIgnoreCase(value)) {
        return constant;
      }
    }
    throw new IllegalArgumentException(
        "no constant of " + enumType.getSimpleName() + " named \"" + value + "\"");
  }

  private Object sequence(String value, SequenceType type) throws CoercionException {
    List<Object> elements = new ArrayList<>();
    if (!value.isBlank()) {
      for (String part : split(value, type.separator())) {
        elements.add(coerce(part, type.element()));
      }
    }
    if (type.collectionKind() == CollectionKind.ARRAY) {
      Object array = Array.newInstance(type.rawType().getComponentType(), elements.size());
      for (int i = 0; i < elements.size(); i++) {
        Array.set(array, i, elements.get(i));
      }
      return array;
    }
    Collection<Object> collection = switch (type.collectionKind()) {
      case SET -> new LinkedHashSet<>();
      case SORTED_SET -> new TreeSet<>();
      default -> new ArrayList<>();
    };
    try {
      collection.addAll(elements);
    } catch (ClassCastException ex) {
      throw new CoercionException("elements are not mutually comparable", ex);
    }
    return collection;
  }

  private Object map(String value, MapType type) throws CoercionException {
    Map<Object, Object> result = type.sorted() ? new TreeMap<>() : new LinkedHashMap<>();
    if (value.isBlank()) {
      return result;
    }
    for (String pair : split(value, type.separator())) {
      String[] parts = pair.split(":", -1);
      if (parts.length != 2) {
        throw new CoercionException("invalid map item: \"" + pair + "\"");
      }
      Object key = coerce(parts[0], type.key());
      Object mapped = coerce(parts[1], type.value());
      try {
        result.put(key, mapped);
      } catch (ClassCastException | NullPointerException ex) {
        throw new CoercionException("invalid map key: \"" + parts[0] + "\"", ex);
      }
    }
    return result;
  }

  private static Object decodable(String value, DecodableType type) throws CoercionException {
    if (type.capability() == DecodeCapability.PARSE) {
      ValueDecoder<?> factory = StringFactories.find(type.rawType()).orElseThrow(
          () -> new CoercionException("no string factory on " + type.rawType().getName()));
      return invoke(factory, value);
    }
    Object instance = allocate(type.rawType());
    try {
      switch (type.capability()) {
        case DECODER -> ((EnvDecoder) instance).decode(value);
        case SETTER -> ((Setter) instance).set(value);
        case TEXT -> ((TextUnmarshaler) instance).unmarshalText(value.getBytes(StandardCharsets.UTF_8));
        case BINARY ->
            ((BinaryUnmarshaler) instance).unmarshalBinary(value.getBytes(StandardCharsets.UTF_8));
        default -> throw new CoercionException("unsupported capability " + type.capability());
      }
    } catch (CoercionException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new CoercionException(messageOf(ex), ex);
    }
    return instance;
  }

  private static Object allocate(Class<?> type) throws CoercionException {
    try {
      Constructor<?> constructor = type.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (NoSuchMethodException ex) {
      throw new CoercionException(type.getName() + " needs a no-argument constructor", ex);
    } catch (InstantiationException | IllegalAccessException | RuntimeException ex) {
      throw new CoercionException("unable to allocate " + type.getName(), ex);
    } catch (InvocationTargetException ex) {
      throw new CoercionException("unable to allocate " + type.getName(), ex.getCause());
    }
  }

  private static Object invoke(ValueDecoder<?> decoder, String value) throws CoercionException {
    try {
      return decoder.decode(value);
    } catch (Exception ex) {
      throw new CoercionException(messageOf(ex), ex);
    }
  }

  private static String[] split(String value, char separator) {
    return value.split(Pattern.quote(String.valueOf(separator)), -1);
  }

  private static String messageOf(Exception ex) {
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }
}
