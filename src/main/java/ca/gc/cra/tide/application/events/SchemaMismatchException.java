package ca.gc.cra.tide.application.events;

/**
 * Raised when a tuple's column count differs from the cached relation schema.
 *
 * @since 0.1.0
 */
public final class SchemaMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param relation qualified relation name
   * @param expected column count from the schema
   * @param actual column count in the tuple
   */
  public SchemaMismatchException(String relation, int expected, int actual) {
    super("tuple for " + relation + " has " + actual + " columns but schema declares " + expected);
  }
}
