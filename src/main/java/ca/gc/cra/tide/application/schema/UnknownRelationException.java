package ca.gc.cra.tide.application.schema;

/**
 * Raised when a change references a relation id for which no Relation message has been seen.
 *
 * @since 0.1.0
 */
public final class UnknownRelationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int relationId;

  /**
   * Creates the exception.
   *
   * @param relationId unresolved relation id
   */
  public UnknownRelationException(int relationId) {
    super("no relation metadata received for relation id " + Integer.toUnsignedString(relationId));
    this.relationId = relationId;
  }

  /**
   * Returns the unresolved relation id.
   *
   * @return relation id
   */
  public int relationId() {
    return relationId;
  }
}
