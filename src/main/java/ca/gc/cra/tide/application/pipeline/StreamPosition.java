package ca.gc.cra.tide.application.pipeline;

import ca.gc.cra.tide.domain.replication.Lsn;
import java.util.Objects;

/**
 * Highest fully processed log position of a stream, plus what has been acknowledged so far.
 *
 * <p>Not thread-safe; owned by one stream runner.</p>
 *
 * @since 0.1.0
 */
public final class StreamPosition {
  private Lsn processed = Lsn.INVALID;
  private Lsn acknowledged = Lsn.INVALID;
  private int pendingMessages;
  private long lastAcknowledgedAtMillis;

  /**
   * Records a processed message. Positions never move backwards.
   *
   * @param position position of the processed message
   */
  public void advance(Lsn position) {
    processed = processed.max(Objects.requireNonNull(position, "position"));
    pendingMessages++;
  }

  /**
   * Records a successful acknowledgment of the current processed position.
   *
   * @param nowMillis acknowledgment time
   */
  public void markAcknowledged(long nowMillis) {
    acknowledged = processed;
    pendingMessages = 0;
    lastAcknowledgedAtMillis = nowMillis;
  }

  /**
   * Restarts the acknowledgment timer without changing positions.
   *
   * @param nowMillis reference time
   */
  public void resetTimer(long nowMillis) {
    lastAcknowledgedAtMillis = nowMillis;
  }

  /**
   * Returns the highest processed position.
   *
   * @return processed position; {@link Lsn#INVALID} before the first message
   */
  public Lsn processed() {
    return processed;
  }

  /**
   * Returns the last acknowledged position.
   *
   * @return acknowledged position; {@link Lsn#INVALID} before the first acknowledgment
   */
  public Lsn acknowledged() {
    return acknowledged;
  }

  /**
   * Returns the number of messages processed since the last acknowledgment.
   *
   * @return pending message count
   */
  public int pendingMessages() {
    return pendingMessages;
  }

  /**
   * Returns the time of the last acknowledgment, or of the last timer reset.
   *
   * @return epoch milliseconds
   */
  public long lastAcknowledgedAtMillis() {
    return lastAcknowledgedAtMillis;
  }

  /**
   * Indicates whether processed progress has not been acknowledged yet.
   *
   * @return {@code true} when the processed position is ahead of the acknowledged one
   */
  public boolean hasUnacknowledged() {
    return processed.compareTo(acknowledged) > 0;
  }
}
