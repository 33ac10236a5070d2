package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Splits a camel-case field name into underscore separated words ({@code multiWordVar} becomes
 * {@code MULTI_WORD_VAR}, {@code httpServer} becomes {@code HTTP_SERVER}).
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface SplitWords {
}
