package ca.gc.cra.tide.domain.schema;

/**
 * Replica identity setting of a relation; decides which old-row columns the server sends.
 *
 * @since 0.1.0
 */
public enum ReplicaIdentity {
  /** Primary key columns ({@code d}). */
  DEFAULT('d'),
  /** No old-row information ({@code n}). */
  NOTHING('n'),
  /** Every column ({@code f}). */
  FULL('f'),
  /** Columns of a chosen unique index ({@code i}). */
  INDEX('i');

  private final char code;

  ReplicaIdentity(char code) {
    this.code = code;
  }

  /**
   * Returns the single-character code used on the wire.
   *
   * @return wire code
   */
  public char code() {
    return code;
  }

  /**
   * Resolves a wire code.
   *
   * @param code wire code
   * @return matching identity setting
   * @throws IllegalArgumentException when the code is unknown
   */
  public static ReplicaIdentity fromCode(char code) {
    for (ReplicaIdentity identity : values()) {
      if (identity.code == code) {
        return identity;
      }
    }
    throw new IllegalArgumentException("unknown replica identity code '" + code + "'");
  }
}
