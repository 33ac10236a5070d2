package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the name segment used to derive a field's environment key.
 *
 * <p>The alias replaces the field name under the current prefix ({@code PREFIX_ALIAS}) and is also
 * consulted on its own ({@code ALIAS}) when the prefixed key is absent. Aliases are case-insensitive
 * and normalized to upper case. Inside an indexed list element the alias is ignored.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface EnvVar {
  /**
   * Returns the alias name.
   *
   * @return alias; blank disables the alias
   */
  String value();
}
