package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.Objects;

/**
 * Announcement of a non built-in data type used by a following Relation message.
 *
 * @param typeOid type OID
 * @param namespace schema of the type
 * @param name type name
 * @since 0.1.0
 */
public record TypeMessage(int typeOid, String namespace, String name) implements PgOutputMessage {
  /**
   * Validates constructor invariants.
   */
  public TypeMessage {
    namespace = Objects.requireNonNull(namespace, "namespace");
    name = Objects.requireNonNull(name, "name");
  }

  @Override
  public MessageTag tag() {
    return MessageTag.TYPE;
  }
}
