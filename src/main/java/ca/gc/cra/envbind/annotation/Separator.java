package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Replaces the comma used to split list elements and map entries.
 *
 * <p>Must be exactly one character and must not be {@code ':'}, which separates map keys from
 * values.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Separator {
  /**
   * Returns the separator character as a string.
   *
   * @return single character separator
   */
  String value();
}
