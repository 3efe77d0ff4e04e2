package ca.gc.cra.tide.application.coercion;

/**
 * Converts the text form of a column value into its Java value.
 *
 * @since 0.1.0
 */
@FunctionalInterface
interface ValueParser {
  /**
   * Parses a non-null text value.
   *
   * @param text text emitted by the server's output function
   * @return parsed value
   * @throws RuntimeException when the text does not match the expected format
   */
  Object parse(String text);
}
