package ca.gc.cra.tide.domain.replication;

import java.util.Locale;

/**
 * <strong>What:</strong> Unsigned 64-bit write-ahead log position reported by the replication stream.
 * <p><strong>Why:</strong> Positions drive acknowledgments; the upstream retains log until a position is flushed.</p>
 * <p><strong>Role:</strong> Domain value object shared by sources, the stream runner, and change events.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders PostgreSQL's {@code XXXXXXXX/XXXXXXXX} form for logs.</p>
 *
 * @param value raw position; compared as an unsigned quantity
 * @since 0.1.0
 */
public record Lsn(long value) implements Comparable<Lsn> {
  /** Position zero; PostgreSQL's {@code InvalidXLogRecPtr}. */
  public static final Lsn INVALID = new Lsn(0L);

  /**
   * Wraps a raw position.
   *
   * @param value raw 64-bit position
   * @return position value
   */
  public static Lsn of(long value) {
    return value == 0L ? INVALID : new Lsn(value);
  }

  /**
   * Parses the textual {@code high/low} hex notation.
   *
   * @param text position such as {@code 16/B374D848}; must not be {@code null}
   * @return parsed position
   * @throws IllegalArgumentException when the text is not in {@code hex/hex} form
   */
  public static Lsn parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("lsn must not be null");
    }
    String trimmed = text.trim();
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("lsn must be formatted as XXXXXXXX/XXXXXXXX (was '" + text + "')");
    }
    try {
      long high = Long.parseLong(trimmed.substring(0, slash), 16);
      long low = Long.parseLong(trimmed.substring(slash + 1), 16);
      if (high < 0 || high > 0xFFFFFFFFL || low < 0 || low > 0xFFFFFFFFL) {
        throw new IllegalArgumentException("lsn segment out of range: " + text);
      }
      return of((high << 32) | low);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("lsn must contain hexadecimal segments (was '" + text + "')", ex);
    }
  }

  /**
   * Returns whether this position is set.
   *
   * @return {@code true} when the position is non-zero
   */
  public boolean isValid() {
    return value != 0L;
  }

  /**
   * Returns the later of two positions.
   *
   * @param other position to compare against; {@code null} yields {@code this}
   * @return the greater position
   */
  public Lsn max(Lsn other) {
    if (other == null) {
      return this;
    }
    return compareTo(other) >= 0 ? this : other;
  }

  @Override
  public int compareTo(Lsn other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%X/%X", value >>> 32, value & 0xFFFFFFFFL);
  }
}
