package ca.gc.cra.tide.application.tx;

import ca.gc.cra.tide.domain.protocol.pgoutput.BeginMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.CommitMessage;
import ca.gc.cra.tide.domain.replication.TransactionContext;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Two-state machine (idle, in transaction) following Begin and Commit messages.
 * <p><strong>Why:</strong> Row changes carry no transaction identity of their own; events borrow the id and commit
 * time of the surrounding Begin.</p>
 * <p><strong>Role:</strong> Application state owned by a single stream runner.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the stream runner thread.</p>
 * <p><strong>Observability:</strong> Logs transaction boundaries at TRACE.</p>
 *
 * @since 0.1.0
 */
public final class TransactionTracker {
  private static final Logger log = LoggerFactory.getLogger(TransactionTracker.class);

  private TransactionContext current;

  /**
   * Enters a transaction.
   *
   * @param begin Begin message; never {@code null}
   * @return context of the new transaction
   * @throws ProtocolSequenceException when a transaction is already open
   */
  public TransactionContext begin(BeginMessage begin) {
    Objects.requireNonNull(begin, "begin");
    if (current != null) {
      throw new ProtocolSequenceException(
          "Begin for transaction " + begin.transactionId()
              + " while transaction " + current.transactionId() + " is still open");
    }
    current = new TransactionContext(begin.transactionId(), begin.finalLsn(), begin.commitTimestamp());
    log.trace("Transaction {} began (final lsn {})", current.transactionId(), current.finalLsn());
    return current;
  }

  /**
   * Leaves the current transaction.
   *
   * @param commit Commit message; never {@code null}
   * @return context of the transaction just committed
   * @throws ProtocolSequenceException when no transaction is open
   */
  public TransactionContext commit(CommitMessage commit) {
    Objects.requireNonNull(commit, "commit");
    if (current == null) {
      throw new ProtocolSequenceException("Commit at " + commit.commitLsn() + " without a preceding Begin");
    }
    TransactionContext finished = current;
    current = null;
    log.trace("Transaction {} committed at {}", finished.transactionId(), commit.commitLsn());
    return finished;
  }

  /**
   * Returns the open transaction.
   *
   * @param what message kind requiring a transaction, used in the failure message
   * @return open transaction context
   * @throws ProtocolSequenceException when no transaction is open
   */
  public TransactionContext require(String what) {
    if (current == null) {
      throw new ProtocolSequenceException(what + " received outside a transaction");
    }
    return current;
  }

  /**
   * Returns the open transaction, if any.
   *
   * @return open transaction context
   */
  public Optional<TransactionContext> current() {
    return Optional.ofNullable(current);
  }

  /**
   * Indicates whether a transaction is open.
   *
   * @return {@code true} between Begin and Commit
   */
  public boolean inTransaction() {
    return current != null;
  }

  /**
   * Returns to the idle state, discarding any open transaction.
   */
  public void reset() {
    current = null;
  }
}
