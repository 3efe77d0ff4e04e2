package ca.gc.cra.tide.domain.replication;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity and commit metadata of the transaction currently being streamed.
 *
 * @param transactionId server transaction id (xid), unsigned 32-bit
 * @param finalLsn log position of the transaction's commit record
 * @param commitTimestamp commit time reported by the Begin message
 * @since 0.1.0
 */
public record TransactionContext(long transactionId, Lsn finalLsn, Instant commitTimestamp) {
  /**
   * Validates constructor invariants.
   */
  public TransactionContext {
    finalLsn = Objects.requireNonNull(finalLsn, "finalLsn");
    commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
  }
}
