package ca.gc.cra.envbind.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Parses an integral field (or the integral elements of a list or map) as unsigned.
 *
 * <p>Negative values are rejected and the accepted range doubles, for example {@code 0..255} for
 * {@code byte}. Values above the signed maximum are stored in two's complement, the same way
 * {@link Integer#parseUnsignedInt(String)} does.</p>
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Unsigned {
}
