package ca.gc.cra.envbind.application.coerce;

/**
 * Raised when a raw string cannot be converted to a target type. The structure walker wraps it
 * into a {@link ca.gc.cra.envbind.domain.failure.ConversionException} naming the key and field.
 *
 * @since 0.1.0
 */
public final class CoercionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public CoercionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public CoercionException(String message, Throwable cause) {
    super(message, cause);
  }
}
