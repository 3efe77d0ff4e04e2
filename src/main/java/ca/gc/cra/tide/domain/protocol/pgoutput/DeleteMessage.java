package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.Objects;

/**
 * Deleted row.
 *
 * @param relationId target relation
 * @param oldTuple identity of the deleted row (key columns or full row)
 * @since 0.1.0
 */
public record DeleteMessage(int relationId, OldTuple oldTuple) implements PgOutputMessage, RawChange {
  /**
   * Validates constructor invariants.
   */
  public DeleteMessage {
    oldTuple = Objects.requireNonNull(oldTuple, "oldTuple");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.DELETE;
  }
}
