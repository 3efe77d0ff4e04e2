package ca.gc.cra.tide.application.tx;

import ca.gc.cra.tide.application.port.FatalReplicationException;

/**
 * Raised when messages arrive outside the Begin ... Commit framing the protocol guarantees.
 *
 * @since 0.1.0
 */
public final class ProtocolSequenceException extends FatalReplicationException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the violation
   */
  public ProtocolSequenceException(String message) {
    super(message);
  }
}
