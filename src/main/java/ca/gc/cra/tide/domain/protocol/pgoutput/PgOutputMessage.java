package ca.gc.cra.tide.domain.protocol.pgoutput;

/**
 * <strong>What:</strong> One decoded {@code pgoutput} replication message.
 * <p><strong>Why:</strong> Gives the stream runner a closed set of variants to route on instead of raw bytes.</p>
 * <p><strong>Role:</strong> Domain output of {@code MessageDecoder}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface PgOutputMessage
    permits BeginMessage,
        CommitMessage,
        OriginMessage,
        RelationMessage,
        TypeMessage,
        InsertMessage,
        UpdateMessage,
        DeleteMessage,
        TruncateMessage {

  /**
   * Returns the variant tag.
   *
   * @return message tag; never {@code null}
   */
  MessageTag tag();
}
