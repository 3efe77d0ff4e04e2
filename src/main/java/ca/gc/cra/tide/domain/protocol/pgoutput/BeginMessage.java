package ca.gc.cra.tide.domain.protocol.pgoutput;

import ca.gc.cra.tide.domain.replication.Lsn;
import java.time.Instant;
import java.util.Objects;

/**
 * Start of a transaction.
 *
 * @param finalLsn position of the transaction's commit record
 * @param commitTimestamp commit time of the transaction
 * @param transactionId transaction id (xid), unsigned 32-bit
 * @since 0.1.0
 */
public record BeginMessage(Lsn finalLsn, Instant commitTimestamp, long transactionId)
    implements PgOutputMessage {
  /**
   * Validates constructor invariants.
   */
  public BeginMessage {
    finalLsn = Objects.requireNonNull(finalLsn, "finalLsn");
    commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.BEGIN;
  }
}
