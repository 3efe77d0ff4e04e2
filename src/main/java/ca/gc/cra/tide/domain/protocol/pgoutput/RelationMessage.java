package ca.gc.cra.tide.domain.protocol.pgoutput;

import ca.gc.cra.tide.domain.schema.RelationSchema;
import java.util.Objects;

/**
 * Relation metadata preceding the first change against a relation, and re-sent when its shape changes.
 *
 * @param schema decoded relation schema
 * @since 0.1.0
 */
public record RelationMessage(RelationSchema schema) implements PgOutputMessage {
  /**
   * Validates constructor invariants.
   */
  public RelationMessage {
    schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.RELATION;
  }
}
