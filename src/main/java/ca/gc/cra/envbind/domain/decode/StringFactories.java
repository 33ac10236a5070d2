package ca.gc.cra.envbind.domain.decode;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Finds the public way a value class builds itself from one string, for types that cannot implement
 * the decoding interfaces, such as {@code URI}, {@code Path}, {@code Instant} or {@code UUID}.
 *
 * <p>Candidates, first match wins: a public static {@code parse}, {@code valueOf}, {@code of},
 * {@code fromString} or {@code create} method taking a {@code String} or {@code CharSequence}
 * (or {@code String, String...}) and returning the type, then a public {@code (String)}
 * constructor of a concrete class.</p>
 *
 * <p>Lookups are cached per class; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class StringFactories {
  private static final List<String> FACTORY_NAMES =
      List.of("parse", "valueOf", "of", "fromString", "create");
  private static final ConcurrentMap<Class<?>, Optional<ValueDecoder<?>>> CACHE =
      new ConcurrentHashMap<>();

  private StringFactories() {
    // Utility
  }

  /**
   * Looks up the string factory of a class.
   *
   * @param type candidate class
   * @return decoder invoking the factory, or empty when the class has none
   */
  public static Optional<ValueDecoder<?>> find(Class<?> type) {
    Objects.requireNonNull(type, "type");
    return CACHE.computeIfAbsent(type, StringFactories::lookup);
  }

  private static Optional<ValueDecoder<?>> lookup(Class<?> type) {
    if (type.isPrimitive() || type.isArray() || !Modifier.isPublic(type.getModifiers())) {
      return Optional.empty();
    }
    Method[] methods = type.getMethods();
    for (String name : FACTORY_NAMES) {
      for (Method method : methods) {
        if (isFactory(method, name, type)) {
          return Optional.of(value -> invoke(method, value));
        }
      }
    }
    if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      return Optional.empty();
    }
    for (Constructor<?> constructor : type.getConstructors()) {
      Class<?>[] params = constructor.getParameterTypes();
      if (params.length == 1 && params[0] == String.class) {
        return Optional.of(value -> construct(constructor, value));
      }
    }
    return Optional.empty();
  }

  private static boolean isFactory(Method method, String name, Class<?> type) {
    int modifiers = method.getModifiers();
    if (!method.getName().equals(name) || !Modifier.isStatic(modifiers)
        || !Modifier.isPublic(method.getDeclaringClass().getModifiers())
        || !type.isAssignableFrom(method.getReturnType())) {
      return false;
    }
    Class<?>[] params = method.getParameterTypes();
    if (params.length == 1) {
      return params[0] == String.class || params[0] == CharSequence.class;
    }
    return params.length == 2 && method.isVarArgs()
        && params[0] == String.class && params[1] == String[].class;
  }

  private static Object invoke(Method method, String value) throws Exception {
    Object[] args = method.getParameterCount() == 1
        ? new Object[] {value}
        : new Object[] {value, new String[0]};
    try {
      return method.invoke(null, args);
    } catch (InvocationTargetException ex) {
      throw unwrap(ex);
    }
  }

  private static Object construct(Constructor<?> constructor, String value) throws Exception {
    try {
      return constructor.newInstance(value);
    } catch (InvocationTargetException ex) {
      throw unwrap(ex);
    }
  }

  private static Exception unwrap(InvocationTargetException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof Exception exception) {
      return exception;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return ex;
  }
}
