package ca.gc.cra.envbind.domain.type;

import java.lang.reflect.Field;
import java.util.Objects;

/**
 * One bindable field of a configuration class.
 *
 * <p>The reflected field is made accessible when the descriptor is built, so {@link #read(Object)}
 * and {@link #write(Object, Object)} only fail on programming errors.</p>
 *
 * @param name declared field name
 * @param field reflected field
 * @param type shape of the field
 * @param metadata binding annotations
 * @since 0.1.0
 */
public record FieldDescriptor(String name, Field field, TypeDescriptor type, FieldMetadata metadata) {
  public FieldDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(metadata, "metadata");
  }

  /**
   * Reads the current value from a target instance.
   *
   * @param target instance declaring the field
   * @return current value, boxed for primitives
   */
  public Object read(Object target) {
    try {
      return field.get(target);
    } catch (IllegalAccessException ex) {
      throw new IllegalStateException("field " + name + " is not accessible", ex);
    }
  }

  /**
   * Writes a value into a target instance.
   *
   * @param target instance declaring the field
   * @param value converted value; unboxed for primitive fields
   * @throws IllegalArgumentException when the value does not fit the field
   */
  public void write(Object target, Object value) {
    try {
      field.set(target, value);
    } catch (IllegalAccessException ex) {
      throw new IllegalStateException("field " + name + " is not accessible", ex);
    }
  }

  /**
   * Returns the declared generic type name used in diagnostics.
   *
   * @return type name such as {@code int} or {@code java.util.List<java.lang.String>}
   */
  public String typeName() {
    return field.getGenericType().getTypeName();
  }
}
