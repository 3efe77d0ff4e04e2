package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.Objects;

/**
 * Old-row image carried by Update and Delete messages.
 *
 * @param kind whether the image holds key columns only or the full row
 * @param data positional values
 * @since 0.1.0
 */
public record OldTuple(Kind kind, TupleData data) {
  /**
   * Validates constructor invariants.
   */
  public OldTuple {
    kind = Objects.requireNonNull(kind, "kind");
    data = Objects.requireNonNull(data, "data");
  }

  /** Wire marker preceding an old-row image. */
  public enum Kind {
    /** Replica identity key columns; other columns are sent as nulls ({@code K}). */
    KEY('K'),
    /** Every column, sent under {@code REPLICA IDENTITY FULL} ({@code O}). */
    FULL('O');

    private final char marker;

    Kind(char marker) {
      this.marker = marker;
    }

    /**
     * Returns the wire marker.
     *
     * @return marker character
     */
    public char marker() {
      return marker;
    }
  }
}
