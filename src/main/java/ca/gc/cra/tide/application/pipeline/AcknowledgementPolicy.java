package ca.gc.cra.tide.application.pipeline;

/**
 * Decides when processed positions are reported upstream.
 *
 * <p>An acknowledgment is due once {@code maxMessages} messages were processed since the last one, or once
 * {@code intervalMillis} elapsed with unacknowledged progress. A non-positive interval disables the time trigger.</p>
 *
 * @param maxMessages processed messages that force an acknowledgment; at least 1
 * @param intervalMillis maximum time between acknowledgments of pending progress
 * @since 0.1.0
 */
public record AcknowledgementPolicy(int maxMessages, long intervalMillis) {
  /** Acknowledge every message. */
  public static final AcknowledgementPolicy EVERY_MESSAGE = new AcknowledgementPolicy(1, 0L);

  /**
   * Validates constructor invariants.
   */
  public AcknowledgementPolicy {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1 (was " + maxMessages + ")");
    }
  }

  /**
   * Defaults used when nothing is configured: 100 messages or 10 seconds.
   *
   * @return default policy
   */
  public static AcknowledgementPolicy defaults() {
    return new AcknowledgementPolicy(100, 10_000L);
  }

  /**
   * Tests whether an acknowledgment should be sent now.
   *
   * @param pendingMessages messages processed since the last acknowledgment
   * @param millisSinceLastAck time since the last acknowledgment
   * @return {@code true} when an acknowledgment is due
   */
  public boolean isDue(int pendingMessages, long millisSinceLastAck) {
    if (pendingMessages <= 0) {
      return false;
    }
    if (pendingMessages >= maxMessages) {
      return true;
    }
    return intervalMillis > 0 && millisSinceLastAck >= intervalMillis;
  }
}
