package ca.gc.cra.envbind.domain.type;

import ca.gc.cra.envbind.annotation.Default;
import ca.gc.cra.envbind.annotation.Description;
import ca.gc.cra.envbind.annotation.Embedded;
import ca.gc.cra.envbind.annotation.EnvVar;
import ca.gc.cra.envbind.annotation.Ignored;
import ca.gc.cra.envbind.annotation.Required;
import ca.gc.cra.envbind.annotation.Separator;
import ca.gc.cra.envbind.annotation.SplitWords;
import ca.gc.cra.envbind.annotation.Unsigned;
import java.lang.reflect.Field;
import java.util.Locale;
import java.util.Objects;

/**
 * Binding metadata declared on one field.
 *
 * @param alias upper-cased alias from {@link EnvVar}; empty when absent
 * @param defaultValue raw default from {@link Default}; empty means no default
 * @param required whether {@link Required} is present
 * @param splitWords whether {@link SplitWords} is present
 * @param ignored whether {@link Ignored} is present
 * @param embedded whether {@link Embedded} is present
 * @param description text from {@link Description}; empty when absent
 * @param separator list/map separator from {@link Separator}, {@code ','} by default
 * @param unsigned whether {@link Unsigned} is present
 * @since 0.1.0
 */
public record FieldMetadata(
    String alias,
    String defaultValue,
    boolean required,
    boolean splitWords,
    boolean ignored,
    boolean embedded,
    String description,
    char separator,
    boolean unsigned) {

  /** Separator used when a field declares none. */
  public static final char DEFAULT_SEPARATOR = ',';

  public FieldMetadata {
    alias = alias == null ? "" : alias.trim().toUpperCase(Locale.ROOT);
    defaultValue = defaultValue == null ? "" : defaultValue;
    description = description == null ? "" : description;
  }

  /**
   * Reads the binding annotations of a field.
   *
   * @param field reflected field
   * @return metadata with defaults for absent annotations
   * @throws IllegalArgumentException when {@link Separator} is not a single character other than {@code ':'}
   */
  public static FieldMetadata of(Field field) {
    Objects.requireNonNull(field, "field");
    EnvVar envVar = field.getAnnotation(EnvVar.class);
    Default def = field.getAnnotation(Default.class);
    Description description = field.getAnnotation(Description.class);
    return new FieldMetadata(
        envVar == null ? "" : envVar.value(),
        def == null ? "" : def.value(),
        field.isAnnotationPresent(Required.class),
        field.isAnnotationPresent(SplitWords.class),
        field.isAnnotationPresent(Ignored.class),
        field.isAnnotationPresent(Embedded.class),
        description == null ? "" : description.value(),
        separatorOf(field),
        field.isAnnotationPresent(Unsigned.class));
  }

  /**
   * Indicates whether an alias was declared.
   *
   * @return {@code true} when {@link #alias()} is non-empty
   */
  public boolean hasAlias() {
    return !alias.isEmpty();
  }

  /**
   * Indicates whether a usable default was declared.
   *
   * @return {@code true} when {@link #defaultValue()} is non-empty
   */
  public boolean hasDefault() {
    return !defaultValue.isEmpty();
  }

  private static char separatorOf(Field field) {
    Separator separator = field.getAnnotation(Separator.class);
    if (separator == null) {
      return DEFAULT_SEPARATOR;
    }
    String value = separator.value();
    if (value == null || value.length() != 1) {
      throw new IllegalArgumentException(
          "invalid separator specified on " + field.getName() + ", '" + value + "'");
    }
    char sep = value.charAt(0);
    if (sep == ':' || Character.isLetterOrDigit(sep) || Character.isWhitespace(sep)) {
      throw new IllegalArgumentException(
          "invalid separator specified on " + field.getName() + ", '" + value + "'");
    }
    return sep;
  }
}
