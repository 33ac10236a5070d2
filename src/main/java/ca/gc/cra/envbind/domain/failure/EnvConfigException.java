package ca.gc.cra.envbind.domain.failure;

/**
 * <strong>What:</strong> Root of the checked failures raised while binding environment variables.
 * <p><strong>Why:</strong> Lets callers handle every terminal binding outcome with a single catch while
 * still distinguishing the cause by subtype.</p>
 * <p><strong>Role:</strong> Domain error type surfaced by the {@code EnvConfig} facade.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see InvalidSpecificationException
 * @see MissingRequiredException
 * @see ConversionException
 * @see MalformedSequenceIndexException
 */
public abstract class EnvConfigException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  protected EnvConfigException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  protected EnvConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
