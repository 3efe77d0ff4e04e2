package ca.gc.cra.tide.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for connection settings, slot names and publication names.
 * <p><strong>Why:</strong> Replication slot and publication names are PostgreSQL identifiers sent inside the
 * {@code START_REPLICATION} command; rejecting bad input early gives a configuration error instead of a server
 * error mid-handshake.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final int MAX_IDENTIFIER_LENGTH = 63;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code "value"} when {@code null}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an unquoted PostgreSQL identifier such as a replication slot or publication name.
   *
   * @param name parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, longer than 63 characters, or not of the form
   *         {@code [A-Za-z_][A-Za-z0-9_]*}
   */
  public static String requireIdentifier(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_IDENTIFIER_LENGTH));
    }
    if (!IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter or underscore and contain only letters, digits, or underscore"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits a length budget.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
