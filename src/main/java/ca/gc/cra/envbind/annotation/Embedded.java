package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Flattens a nested configuration object into its parent's namespace.
 *
 * <p>Fields of an embedded object are keyed under the parent prefix with no segment for the
 * embedding field itself, unless the field also carries an {@link EnvVar} alias.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Embedded {
}
