package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Supplies the raw string used when neither the canonical nor the alias key is present.
 *
 * <p>The default is converted exactly like an environment value. An empty default is treated as
 * no default at all.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Default {
  /**
   * Returns the default value.
   *
   * @return raw default string
   */
  String value();
}
