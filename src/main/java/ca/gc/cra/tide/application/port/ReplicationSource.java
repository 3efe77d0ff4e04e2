package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.replication.ReplicationFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Domain port that supplies demarcated replication messages and accepts flush acknowledgments.
 * <p><strong>Why:</strong> Keeps the stream runner independent from the database driver and the network session.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code PgReplicationSource} and by scripted test sources.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close the replication session.</li>
 *   <li>Return the next message with its log position, waiting at most a bounded poll interval.</li>
 *   <li>Report processed positions upstream so retained log can be released.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single reader; {@link #receive()} and {@link #acknowledge(Lsn)} are called from the
 * stream runner thread only.</p>
 * <p><strong>Performance:</strong> {@link #receive()} is the only suspension point of the stream loop.</p>
 * <p><strong>Observability:</strong> Adapters log session lifecycle; the runner counts received messages.</p>
 *
 * @implNote Callers must invoke {@link #start()} before receiving and always call {@link #close()}.
 * @since 0.1.0
 */
public interface ReplicationSource extends AutoCloseable {
  /**
   * Opens the replication session.
   *
   * @throws Exception if the session cannot be established
   */
  void start() throws Exception;

  /**
   * Retrieves the next message when one arrives within the poll interval.
   *
   * @return next frame; empty when nothing arrived in time or the source is exhausted
   * @throws InterruptedException if the waiting thread is interrupted
   * @throws Exception if the session fails
   */
  Optional<ReplicationFrame> receive() throws Exception;

  /**
   * Reports that every message up to and including {@code position} has been processed.
   *
   * @param position processed position; never {@code null}
   * @throws Exception if the status update cannot be sent
   */
  void acknowledge(Lsn position) throws Exception;

  /**
   * Indicates whether the source will deliver no further messages.
   *
   * @return {@code true} when the source is drained or the session ended
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Closes the replication session.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  void close() throws Exception;
}
