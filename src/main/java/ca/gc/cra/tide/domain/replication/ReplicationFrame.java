package ca.gc.cra.tide.domain.replication;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One demarcated replication message together with the log position it was received at.
 * <p><strong>Why:</strong> Lets sources hand opaque message bytes to the decoder without exposing mutable buffers.</p>
 * <p><strong>Role:</strong> Domain value object bridging the replication source and message decoding.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload is copied on construction and on access.</p>
 *
 * @param position log position reported for the message; never {@code null}
 * @param payload raw pgoutput message bytes; defensively copied
 * @since 0.1.0
 */
public record ReplicationFrame(Lsn position, byte[] payload) {
  /**
   * Validates the position and copies the payload.
   */
  public ReplicationFrame {
    position = Objects.requireNonNull(position, "position");
    payload = payload != null ? payload.clone() : new byte[0];
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ReplicationFrame that)) {
      return false;
    }
    return position.equals(that.position) && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * position.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "ReplicationFrame{position=" + position + ", bytes=" + payload.length + '}';
  }
}
