package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> One column value inside tuple data, before type coercion.
 * <p><strong>Why:</strong> Keeps null, unchanged-toast, and payload-bearing values distinct until a column type is known.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload copied on construction and access.</p>
 *
 * @param kind value kind; never {@code null}
 * @param bytes payload for {@link Kind#TEXT} and {@link Kind#BINARY}; empty otherwise
 * @since 0.1.0
 */
public record TupleField(Kind kind, byte[] bytes) {
  /** Shared SQL null value. */
  public static final TupleField NULL = new TupleField(Kind.NULL, null);
  /** Shared unchanged-toast marker. */
  public static final TupleField UNCHANGED_TOAST = new TupleField(Kind.UNCHANGED_TOAST, null);

  /**
   * Validates the kind and copies the payload.
   */
  public TupleField {
    kind = Objects.requireNonNull(kind, "kind");
    bytes = bytes == null ? new byte[0] : bytes.clone();
  }

  /**
   * Creates a text-format value.
   *
   * @param bytes UTF-8 text bytes
   * @return text field
   */
  public static TupleField text(byte[] bytes) {
    return new TupleField(Kind.TEXT, bytes);
  }

  /**
   * Creates a text-format value from a string.
   *
   * @param text value text; must not be {@code null}
   * @return text field
   */
  public static TupleField text(String text) {
    return text(Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Creates a binary-format value.
   *
   * @param bytes type-specific binary payload
   * @return binary field
   */
  public static TupleField binary(byte[] bytes) {
    return new TupleField(Kind.BINARY, bytes);
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Decodes the payload as UTF-8 text.
   *
   * @return payload text; empty for null and unchanged-toast values
   */
  public String text() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TupleField that)) {
      return false;
    }
    return kind == that.kind && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case NULL -> "null";
      case UNCHANGED_TOAST -> "<unchanged-toast>";
      case TEXT -> "'" + text() + "'";
      case BINARY -> "<" + bytes.length + " bytes>";
    };
  }

  /** Kind byte preceding each column in tuple data. */
  public enum Kind {
    /** SQL null ({@code n}). */
    NULL('n'),
    /** Toasted value not resent because it did not change ({@code u}). */
    UNCHANGED_TOAST('u'),
    /** Text-format value ({@code t}). */
    TEXT('t'),
    /** Binary-format value ({@code b}). */
    BINARY('b');

    private final char code;

    Kind(char code) {
      this.code = code;
    }

    /**
     * Returns the wire kind byte.
     *
     * @return kind character
     */
    public char code() {
      return code;
    }
  }
}
