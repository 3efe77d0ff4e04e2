package ca.gc.cra.tide.domain.protocol.pgoutput;

import ca.gc.cra.tide.domain.replication.Lsn;
import java.util.Objects;

/**
 * Replication origin of the current transaction, sent for changes replayed from another node.
 *
 * @param originLsn commit position on the origin server
 * @param name origin name
 * @since 0.1.0
 */
public record OriginMessage(Lsn originLsn, String name) implements PgOutputMessage {
  /**
   * Validates constructor invariants.
   */
  public OriginMessage {
    originLsn = Objects.requireNonNull(originLsn, "originLsn");
    name = Objects.requireNonNull(name, "name");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.ORIGIN;
  }
}
