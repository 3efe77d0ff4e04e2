package ca.gc.cra.tide.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for row values and credentials.
 * <p><strong>Why:</strong> Column values can be large (JSON documents, TOAST-ed text) and connection settings
 * carry passwords; neither should reach operator logs verbatim.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by value coercion, the logging handler, and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut in the middle of a code point is dropped.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes bytes to retain; must be positive
   * @return {@code value} when it fits, otherwise a prefix followed by {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Returns the redaction placeholder for a secret, or an empty string when no secret is set.
   *
   * @param value secret value
   * @return {@code "[REDACTED]"} for non-empty secrets, {@code ""} otherwise
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? "" : REDACTED_PLACEHOLDER;
  }
}
