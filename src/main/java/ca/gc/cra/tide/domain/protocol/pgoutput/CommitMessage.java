package ca.gc.cra.tide.domain.protocol.pgoutput;

import ca.gc.cra.tide.domain.replication.Lsn;
import java.time.Instant;
import java.util.Objects;

/**
 * End of a transaction.
 *
 * @param flags commit flags; currently unused by the server and always zero
 * @param commitLsn position of the commit record
 * @param endLsn position just past the commit record
 * @param commitTimestamp commit time of the transaction
 * @since 0.1.0
 */
public record CommitMessage(int flags, Lsn commitLsn, Lsn endLsn, Instant commitTimestamp)
    implements PgOutputMessage {
  /**
   * Validates constructor invariants.
   */
  public CommitMessage {
    commitLsn = Objects.requireNonNull(commitLsn, "commitLsn");
    endLsn = Objects.requireNonNull(endLsn, "endLsn");
    commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.COMMIT;
  }
}
