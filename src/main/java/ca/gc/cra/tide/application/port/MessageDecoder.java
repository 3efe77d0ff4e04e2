package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.protocol.pgoutput.PgOutputMessage;

/**
 * <strong>What:</strong> Domain port that turns one raw replication message into its structured form.
 * <p><strong>Why:</strong> Keeps binary protocol parsing apart from routing, caching, and dispatch.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code PgOutputMessageDecoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode exactly one message variant per buffer.</li>
 *   <li>Reject unknown tags and malformed bodies with {@link DecodeException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe to share.</p>
 * <p><strong>Performance:</strong> Linear in the message size; no state retained between calls.</p>
 * <p><strong>Observability:</strong> Implementations do not log; the stream runner records failures.</p>
 *
 * @since 0.1.0
 */
public interface MessageDecoder {
  /**
   * Decodes a single message buffer.
   *
   * @param payload raw message bytes, starting with the tag byte; must not be {@code null}
   * @return decoded message; never {@code null}
   * @throws DecodeException when the tag is unknown or the body is malformed
   */
  PgOutputMessage decode(byte[] payload);
}
