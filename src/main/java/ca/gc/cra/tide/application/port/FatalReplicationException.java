package ca.gc.cra.tide.application.port;

/**
 * Base type for errors after which a replication stream cannot safely continue.
 *
 * <p>The stream runner stops on these and leaves the failing message unacknowledged, so a restarted
 * stream receives it again.</p>
 *
 * @since 0.1.0
 */
public abstract class FatalReplicationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a fatal error with a message.
   *
   * @param message description of the failure
   */
  protected FatalReplicationException(String message) {
    super(message);
  }

  /**
   * Creates a fatal error with a message and cause.
   *
   * @param message description of the failure
   * @param cause underlying failure
   */
  protected FatalReplicationException(String message, Throwable cause) {
    super(message, cause);
  }
}
