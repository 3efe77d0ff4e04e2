package ca.gc.cra.tide.domain.protocol.pgoutput;

/**
 * Leading byte identifying a {@code pgoutput} message variant.
 *
 * @since 0.1.0
 */
public enum MessageTag {
  BEGIN('B'),
  COMMIT('C'),
  ORIGIN('O'),
  RELATION('R'),
  TYPE('Y'),
  INSERT('I'),
  UPDATE('U'),
  DELETE('D'),
  TRUNCATE('T');

  private final char code;

  MessageTag(char code) {
    this.code = code;
  }

  /**
   * Returns the wire character for this tag.
   *
   * @return tag character
   */
  public char code() {
    return code;
  }

  /**
   * Resolves a wire byte to a tag.
   *
   * @param code leading message byte
   * @return matching tag, or {@code null} when the byte is not a known tag
   */
  public static MessageTag fromCode(int code) {
    for (MessageTag tag : values()) {
      if (tag.code == code) {
        return tag;
      }
    }
    return null;
  }
}
