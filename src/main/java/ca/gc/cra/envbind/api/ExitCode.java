package ca.gc.cra.envbind.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code envbind} command line.
 * <p><strong>Why:</strong> Lets deployment scripts tell a bad invocation from a bad environment.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid or the configuration class could not be loaded. */
  INVALID_ARGS(2),
  /** An input file could not be read. */
  IO_ERROR(3),
  /** The environment does not satisfy the configuration class, or an input file is malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
