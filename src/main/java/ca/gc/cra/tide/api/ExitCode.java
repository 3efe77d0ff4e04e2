package ca.gc.cra.tide.api;

/**
 * <strong>What:</strong> Process exit codes shared by TIDE commands.
 * <p><strong>Why:</strong> Supervisors restart on {@link #RUNTIME_FAILURE} or {@link #IO_ERROR} but not on
 * {@link #INVALID_ARGS}; stable numbers let them tell these apart.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution or a normal stop. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The database connection or a configuration file could not be used. */
  IO_ERROR(3),
  /** Configuration was rejected while wiring the stream. */
  CONFIG_ERROR(4),
  /** The stream stopped on a decode or protocol failure, or failed unexpectedly. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
