package ca.gc.cra.tide.infrastructure.protocol.pgoutput;

import ca.gc.cra.tide.application.port.DecodeException;
import ca.gc.cra.tide.application.port.MessageDecoder;
import ca.gc.cra.tide.domain.protocol.pgoutput.BeginMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.CommitMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.DeleteMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.InsertMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.MessageTag;
import ca.gc.cra.tide.domain.protocol.pgoutput.OldTuple;
import ca.gc.cra.tide.domain.protocol.pgoutput.OriginMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.PgOutputMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.RelationMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.TruncateMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleData;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleField;
import ca.gc.cra.tide.domain.protocol.pgoutput.TypeMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.UpdateMessage;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.schema.ColumnDescriptor;
import ca.gc.cra.tide.domain.schema.RelationSchema;
import ca.gc.cra.tide.domain.schema.ReplicaIdentity;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decodes {@code pgoutput} protocol version 1 messages into {@link PgOutputMessage} variants.
 * <p><strong>Why:</strong> Isolates byte-level parsing so the stream runner only routes structured messages.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link MessageDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a single instance may be shared by several runners.</p>
 * <p><strong>Performance:</strong> One pass over the buffer; tuple payloads are copied once into {@link TupleField}s.</p>
 *
 * @implNote Integers are big-endian, strings are NUL-terminated UTF-8, timestamps are microseconds since
 * 2000-01-01 UTC. Trailing bytes after a complete message are treated as corruption.
 * @since 0.1.0
 */
public final class PgOutputMessageDecoder implements MessageDecoder {
  /** Origin of PostgreSQL timestamps. */
  public static final Instant POSTGRES_EPOCH = Instant.parse("2000-01-01T00:00:00Z");

  private static final String DEFAULT_NAMESPACE = "pg_catalog";

  /**
   * Creates a decoder.
   */
  public PgOutputMessageDecoder() {}

  @Override
  public PgOutputMessage decode(byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    if (payload.length == 0) {
      throw new DecodeException(-1, "buffer is empty");
    }
    int code = payload[0] & 0xFF;
    MessageTag tag = MessageTag.fromCode(code);
    if (tag == null) {
      throw new DecodeException(code, "unknown message tag");
    }

    ByteBuffer buf = ByteBuffer.wrap(payload);
    buf.position(1);
    try {
      PgOutputMessage message = switch (tag) {
        case BEGIN -> decodeBegin(buf);
        case COMMIT -> decodeCommit(buf);
        case ORIGIN -> new OriginMessage(Lsn.of(buf.getLong()), readString(buf, code));
        case RELATION -> decodeRelation(buf, code);
        case TYPE -> new TypeMessage(buf.getInt(), readString(buf, code), readString(buf, code));
        case INSERT -> decodeInsert(buf, code);
        case UPDATE -> decodeUpdate(buf, code);
        case DELETE -> decodeDelete(buf, code);
        case TRUNCATE -> decodeTruncate(buf, code);
      };
      if (buf.hasRemaining()) {
        throw new DecodeException(code, buf.remaining() + " trailing bytes after message body");
      }
      return message;
    } catch (BufferUnderflowException ex) {
      throw new DecodeException(code, "message ended at byte " + buf.position() + " of " + payload.length, ex);
    } catch (IllegalArgumentException ex) {
      throw new DecodeException(code, ex.getMessage(), ex);
    }
  }

  /**
   * Converts a PostgreSQL timestamp to an {@link Instant}.
   *
   * @param micros microseconds since 2000-01-01 UTC
   * @return corresponding instant
   */
  public static Instant toInstant(long micros) {
    return POSTGRES_EPOCH.plus(micros, ChronoUnit.MICROS);
  }

  private static BeginMessage decodeBegin(ByteBuffer buf) {
    Lsn finalLsn = Lsn.of(buf.getLong());
    Instant commitTimestamp = toInstant(buf.getLong());
    long xid = Integer.toUnsignedLong(buf.getInt());
    return new BeginMessage(finalLsn, commitTimestamp, xid);
  }

  private static CommitMessage decodeCommit(ByteBuffer buf) {
    int flags = buf.get() & 0xFF;
    Lsn commitLsn = Lsn.of(buf.getLong());
    Lsn endLsn = Lsn.of(buf.getLong());
    Instant commitTimestamp = toInstant(buf.getLong());
    return new CommitMessage(flags, commitLsn, endLsn, commitTimestamp);
  }

  private static RelationMessage decodeRelation(ByteBuffer buf, int code) {
    int relationId = buf.getInt();
    String namespace = readString(buf, code);
    if (namespace.isEmpty()) {
      namespace = DEFAULT_NAMESPACE;
    }
    String name = readString(buf, code);
    ReplicaIdentity identity = ReplicaIdentity.fromCode((char) (buf.get() & 0xFF));
    int columnCount = Short.toUnsignedInt(buf.getShort());
    List<ColumnDescriptor> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      int flags = buf.get() & 0xFF;
      String columnName = readString(buf, code);
      int typeOid = buf.getInt();
      int typeModifier = buf.getInt();
      columns.add(new ColumnDescriptor(columnName, typeOid, typeModifier, (flags & 1) != 0));
    }
    return new RelationMessage(new RelationSchema(relationId, namespace, name, identity, columns));
  }

  private static InsertMessage decodeInsert(ByteBuffer buf, int code) {
    int relationId = buf.getInt();
    expectMarker(buf, 'N', code);
    return new InsertMessage(relationId, readTuple(buf, code));
  }

  private static UpdateMessage decodeUpdate(ByteBuffer buf, int code) {
    int relationId = buf.getInt();
    int marker = buf.get() & 0xFF;
    Optional<OldTuple> oldTuple = Optional.empty();
    if (marker == 'K' || marker == 'O') {
      oldTuple = Optional.of(new OldTuple(oldKind(marker), readTuple(buf, code)));
      marker = buf.get() & 0xFF;
    }
    if (marker != 'N') {
      throw new DecodeException(code, "expected new tuple marker 'N' but found 0x" + Integer.toHexString(marker));
    }
    return new UpdateMessage(relationId, oldTuple, readTuple(buf, code));
  }

  private static DeleteMessage decodeDelete(ByteBuffer buf, int code) {
    int relationId = buf.getInt();
    int marker = buf.get() & 0xFF;
    if (marker != 'K' && marker != 'O') {
      throw new DecodeException(code, "expected old tuple marker 'K' or 'O' but found 0x" + Integer.toHexString(marker));
    }
    return new DeleteMessage(relationId, new OldTuple(oldKind(marker), readTuple(buf, code)));
  }

  private static TruncateMessage decodeTruncate(ByteBuffer buf, int code) {
    int count = buf.getInt();
    if (count < 0) {
      throw new DecodeException(code, "negative relation count " + count);
    }
    int options = buf.get() & 0xFF;
    List<Integer> relationIds = new ArrayList<>(Math.min(count, buf.remaining() / 4));
    for (int i = 0; i < count; i++) {
      relationIds.add(buf.getInt());
    }
    return new TruncateMessage(options, relationIds);
  }

  private static TupleData readTuple(ByteBuffer buf, int code) {
    int columnCount = Short.toUnsignedInt(buf.getShort());
    List<TupleField> fields = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      int kind = buf.get() & 0xFF;
      switch (kind) {
        case 'n' -> fields.add(TupleField.NULL);
        case 'u' -> fields.add(TupleField.UNCHANGED_TOAST);
        case 't' -> fields.add(TupleField.text(readBytes(buf, code)));
        case 'b' -> fields.add(TupleField.binary(readBytes(buf, code)));
        default -> throw new DecodeException(
            code, "unknown tuple value kind 0x" + Integer.toHexString(kind) + " at column " + i);
      }
    }
    return new TupleData(fields);
  }

  private static byte[] readBytes(ByteBuffer buf, int code) {
    int length = buf.getInt();
    if (length < 0) {
      throw new DecodeException(code, "negative value length " + length);
    }
    if (length > buf.remaining()) {
      throw new DecodeException(code, "value length " + length + " exceeds remaining " + buf.remaining());
    }
    byte[] bytes = new byte[length];
    buf.get(bytes);
    return bytes;
  }

  private static String readString(ByteBuffer buf, int code) {
    int start = buf.position();
    int end = start;
    while (end < buf.limit() && buf.get(end) != 0) {
      end++;
    }
    if (end >= buf.limit()) {
      throw new DecodeException(code, "unterminated string at byte " + start);
    }
    String value = new String(buf.array(), buf.arrayOffset() + start, end - start, StandardCharsets.UTF_8);
    buf.position(end + 1);
    return value;
  }

  private static void expectMarker(ByteBuffer buf, char expected, int code) {
    int marker = buf.get() & 0xFF;
    if (marker != expected) {
      throw new DecodeException(
          code, "expected tuple marker '" + expected + "' but found 0x" + Integer.toHexString(marker));
    }
  }

  private static OldTuple.Kind oldKind(int marker) {
    return marker == 'K' ? OldTuple.Kind.KEY : OldTuple.Kind.FULL;
  }
}
