package ca.gc.cra.tide.application.coercion;

/**
 * Raised when a text value cannot be converted to the Java type mapped for its column type.
 *
 * @since 0.1.0
 */
public final class CoercionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int typeOid;

  /**
   * Creates the exception.
   *
   * @param typeOid column type OID
   * @param message description of the failure
   * @param cause parser failure, may be {@code null}
   */
  public CoercionException(int typeOid, String message, Throwable cause) {
    super("type " + typeOid + ": " + message, cause);
    this.typeOid = typeOid;
  }

  /**
   * Returns the column type OID.
   *
   * @return type OID
   */
  public int typeOid() {
    return typeOid;
  }
}
