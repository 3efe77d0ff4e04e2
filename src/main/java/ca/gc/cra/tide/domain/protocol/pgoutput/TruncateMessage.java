package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.ArrayList;
import java.util.List;

/**
 * Truncation of one or more relations in a single statement.
 *
 * @param options option bits ({@link #CASCADE}, {@link #RESTART_IDENTITY})
 * @param relationIds truncated relations in wire order; copied
 * @since 0.1.0
 */
public record TruncateMessage(int options, List<Integer> relationIds) implements PgOutputMessage {
  /** Option bit set for {@code TRUNCATE ... CASCADE}. */
  public static final int CASCADE = 1;
  /** Option bit set for {@code TRUNCATE ... RESTART IDENTITY}. */
  public static final int RESTART_IDENTITY = 2;

  /**
   * Copies the relation id list.
   */
  public TruncateMessage {
    relationIds = relationIds == null ? List.of() : List.copyOf(relationIds);
  }

  @Override
  public MessageTag tag() {
    return MessageTag.TRUNCATE;
  }

  /**
   * Returns whether {@code CASCADE} was requested.
   *
   * @return {@code true} when the cascade bit is set
   */
  public boolean cascade() {
    return (options & CASCADE) != 0;
  }

  /**
   * Returns whether {@code RESTART IDENTITY} was requested.
   *
   * @return {@code true} when the restart-identity bit is set
   */
  public boolean restartIdentity() {
    return (options & RESTART_IDENTITY) != 0;
  }

  /**
   * Splits the message into one change per relation, preserving wire order.
   *
   * @return per-relation truncations
   */
  public List<TruncatedRelation> split() {
    List<TruncatedRelation> parts = new ArrayList<>(relationIds.size());
    for (int relationId : relationIds) {
      parts.add(new TruncatedRelation(relationId, cascade(), restartIdentity()));
    }
    return List.copyOf(parts);
  }
}
