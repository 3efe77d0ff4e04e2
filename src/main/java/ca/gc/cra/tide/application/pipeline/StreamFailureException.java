package ca.gc.cra.tide.application.pipeline;

import ca.gc.cra.tide.application.port.FatalReplicationException;
import ca.gc.cra.tide.domain.replication.Lsn;

/**
 * Raised by {@link StreamRunner#run()} when a fatal decode or protocol error stops the stream.
 *
 * <p>The failing message was not acknowledged; restarting from the slot redelivers it.</p>
 *
 * @since 0.1.0
 */
public final class StreamFailureException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Lsn position;

  /**
   * Creates the exception.
   *
   * @param position position of the failing message
   * @param cause fatal error
   */
  public StreamFailureException(Lsn position, FatalReplicationException cause) {
    super("replication stream stopped at " + position + ": " + cause.getMessage(), cause);
    this.position = position;
  }

  /**
   * Returns the position of the failing message.
   *
   * @return failing position
   */
  public Lsn position() {
    return position;
  }
}
