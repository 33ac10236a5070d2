package ca.gc.cra.envbind.domain.failure;

/**
 * Raised when the keys under an indexed list prefix carry a malformed index segment, or when the
 * collected indices are not contiguous from zero.
 *
 * @since 0.1.0
 */
public final class MalformedSequenceIndexException extends EnvConfigException {
  private static final long serialVersionUID = 1L;

  private final String prefix;

  /**
   * Creates an exception for the given list prefix.
   *
   * @param prefix key prefix the elements were scanned under
   * @param message human-readable error
   */
  public MalformedSequenceIndexException(String prefix, String message) {
    super(message);
    this.prefix = prefix;
  }

  /**
   * Returns the list prefix that failed validation.
   *
   * @return key prefix
   */
  public String prefix() {
    return prefix;
  }
}
