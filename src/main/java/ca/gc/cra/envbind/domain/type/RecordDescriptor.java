package ca.gc.cra.envbind.domain.type;

import ca.gc.cra.envbind.domain.failure.InvalidSpecificationException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Objects;

/**
 * Bindable fields of one configuration class, superclass fields first, each in declaration order.
 *
 * @param type configuration class
 * @param fields bindable fields, including ignored ones
 * @since 0.1.0
 */
public record RecordDescriptor(Class<?> type, List<FieldDescriptor> fields) {
  public RecordDescriptor {
    Objects.requireNonNull(type, "type");
    fields = List.copyOf(fields);
  }

  /**
   * Allocates a fresh instance through the no-argument constructor.
   *
   * @return new instance
   * @throws InvalidSpecificationException when the class has no usable no-argument constructor
   */
  public Object newInstance() throws InvalidSpecificationException {
    try {
      Constructor<?> constructor = type.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (NoSuchMethodException ex) {
      throw new InvalidSpecificationException(
          type.getName() + " needs a no-argument constructor to be allocated", ex);
    } catch (InstantiationException | IllegalAccessException | InvocationTargetException
        | RuntimeException ex) {
      throw new InvalidSpecificationException("unable to allocate " + type.getName(), ex);
    }
  }
}
