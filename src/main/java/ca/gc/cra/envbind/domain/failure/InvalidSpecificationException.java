package ca.gc.cra.envbind.domain.failure;

/**
 * Raised when the binding target is not a mutable configuration object, or when its class carries
 * metadata that cannot be honoured. No field has been touched when this is thrown.
 *
 * @since 0.1.0
 */
public final class InvalidSpecificationException extends EnvConfigException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public InvalidSpecificationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, typically a reflection failure
   */
  public InvalidSpecificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
