package ca.gc.cra.tide.domain.events;

/**
 * Value placed in a change event for a toasted column the server did not resend.
 *
 * <p>The column's value is unknown, not null: the row still holds whatever it held before the update.</p>
 *
 * @since 0.1.0
 */
public enum UnchangedToast {
  VALUE;

  @Override
  public String toString() {
    return "<unchanged-toast>";
  }
}
