package ca.gc.cra.envbind.infrastructure.usage;

import ca.gc.cra.envbind.domain.type.DecodableType;
import ca.gc.cra.envbind.domain.type.MapType;
import ca.gc.cra.envbind.domain.type.OpaqueType;
import ca.gc.cra.envbind.domain.type.OptionalType;
import ca.gc.cra.envbind.domain.type.RecordType;
import ca.gc.cra.envbind.domain.type.ScalarType;
import ca.gc.cra.envbind.domain.type.SequenceType;
import ca.gc.cra.envbind.domain.type.TypeDescriptor;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable type names shown in usage output.
 *
 * @since 0.1.0
 */
public final class TypeDescriptions {
  private TypeDescriptions() {}

  /**
   * Describes a field type.
   *
   * @param type descriptor
   * @return description such as {@code Integer} or {@code Comma-separated list of String}
   */
  public static String describe(TypeDescriptor type) {
    if (type instanceof ScalarType scalar) {
      return describeScalar(scalar);
    }
    if (type instanceof OptionalType optional) {
      return describe(optional.element());
    }
    if (type instanceof SequenceType sequence) {
      if (sequence.ofRecords()) {
        return "Indexed list of " + sequence.element().rawType().getSimpleName();
      }
      return separatorName(sequence.separator()) + "-separated list of "
          + describe(sequence.element());
    }
    if (type instanceof MapType map) {
      return separatorName(map.separator()) + "-separated list of " + describe(map.key()) + ":"
          + describe(map.value()) + " pairs";
    }
    if (type instanceof RecordType || type instanceof DecodableType) {
      return type.rawType().getSimpleName();
    }
    OpaqueType opaque = (OpaqueType) type;
    return opaque.rawType() == Object.class
        ? opaque.javaType().getTypeName()
        : opaque.rawType().getSimpleName();
  }

  /**
   * Names a list separator.
   *
   * @param separator separator character
   * @return name such as {@code Comma}, or the quoted character when it has no name
   */
  public static String separatorName(char separator) {
    return switch (separator) {
      case ',' -> "Comma";
      case ';' -> "Semicolon";
      case '-' -> "Dash";
      case '/' -> "Slash";
      case '\\' -> "Backslash";
      case '|' -> "Bar";
      case '~' -> "Tilde";
      case '&' -> "Ampersand";
      case '#' -> "Hash";
      case '@' -> "At";
      case '.' -> "Period";
      case '*' -> "Asterisk";
      case '+' -> "Plus";
      default -> "\"" + separator + "\"";
    };
  }

  private static String describeScalar(ScalarType scalar) {
    return switch (scalar.kind()) {
      case STRING -> "String";
      case CHAR -> "Character";
      case BOOL -> "True or False";
      case INT8, INT16, INT32, INT64, BIG_INTEGER -> "Integer";
      case UINT8, UINT16, UINT32, UINT64 -> "Unsigned Integer";
      case FLOAT32, FLOAT64 -> "Float";
      case BIG_DECIMAL -> "Decimal";
      case DURATION -> "Duration";
      case BYTES -> "Bytes";
      case ENUM -> enumDescription(scalar.rawType());
    };
  }

  private static String enumDescription(Class<?> enumType) {
    List<String> names = new ArrayList<>();
    for (Object constant : enumType.getEnumConstants()) {
      names.add(((Enum<?>) constant).name());
    }
    return "One of " + String.join(", ", names);
  }
}
