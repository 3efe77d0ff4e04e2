package ca.gc.cra.tide.application.port;

/**
 * Raised when a replication message has an unknown tag or a malformed body.
 *
 * @since 0.1.0
 */
public final class DecodeException extends FatalReplicationException {
  private static final long serialVersionUID = 1L;

  private final int tag;

  /**
   * Creates a decode failure.
   *
   * @param tag leading byte of the offending message, or {@code -1} when the buffer was empty
   * @param message description of the failure
   */
  public DecodeException(int tag, String message) {
    super(describe(tag) + ": " + message);
    this.tag = tag;
  }

  /**
   * Creates a decode failure with a cause.
   *
   * @param tag leading byte of the offending message, or {@code -1} when the buffer was empty
   * @param message description of the failure
   * @param cause underlying failure
   */
  public DecodeException(int tag, String message, Throwable cause) {
    super(describe(tag) + ": " + message, cause);
    this.tag = tag;
  }

  /**
   * Returns the leading byte of the offending message.
   *
   * @return tag byte, or {@code -1} for an empty buffer
   */
  public int tag() {
    return tag;
  }

  private static String describe(int tag) {
    if (tag < 0) {
      return "empty message";
    }
    if (tag >= 0x20 && tag < 0x7F) {
      return "message '" + (char) tag + "'";
    }
    return String.format("message 0x%02X", tag);
  }
}
