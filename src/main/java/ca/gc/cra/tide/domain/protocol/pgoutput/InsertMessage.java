package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.Objects;

/**
 * Inserted row.
 *
 * @param relationId target relation
 * @param newTuple inserted values in column order
 * @since 0.1.0
 */
public record InsertMessage(int relationId, TupleData newTuple) implements PgOutputMessage, RawChange {
  /**
   * Validates constructor invariants.
   */
  public InsertMessage {
    newTuple = Objects.requireNonNull(newTuple, "newTuple");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.INSERT;
  }
}
