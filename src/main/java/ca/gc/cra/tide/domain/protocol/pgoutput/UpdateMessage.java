package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.Objects;
import java.util.Optional;

/**
 * Updated row.
 *
 * @param relationId target relation
 * @param oldTuple old-row image when the server sent one; empty otherwise
 * @param newTuple new values in column order
 * @since 0.1.0
 */
public record UpdateMessage(int relationId, Optional<OldTuple> oldTuple, TupleData newTuple)
    implements PgOutputMessage, RawChange {
  /**
   * Validates constructor invariants.
   */
  public UpdateMessage {
    oldTuple = oldTuple == null ? Optional.empty() : oldTuple;
    newTuple = Objects.requireNonNull(newTuple, "newTuple");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.UPDATE;
  }
}
