package ca.gc.cra.tide.application.dispatch;

import ca.gc.cra.tide.domain.events.ChangeType;
import java.util.Locale;

/**
 * Event-type half of a subscription filter.
 *
 * @since 0.1.0
 */
public enum EventTypeFilter {
  ANY(null),
  INSERT(ChangeType.INSERT),
  UPDATE(ChangeType.UPDATE),
  DELETE(ChangeType.DELETE),
  TRUNCATE(ChangeType.TRUNCATE);

  private final ChangeType type;

  EventTypeFilter(ChangeType type) {
    this.type = type;
  }

  /**
   * Tests an event type against this filter.
   *
   * @param candidate event type
   * @return {@code true} for {@link #ANY} or an equal type
   */
  public boolean matches(ChangeType candidate) {
    return type == null || type == candidate;
  }

  /**
   * Returns the filter accepting exactly one change type.
   *
   * @param type change type; never {@code null}
   * @return matching filter
   */
  public static EventTypeFilter of(ChangeType type) {
    return valueOf(type.name());
  }

  /**
   * Parses a filter name case-insensitively; {@code *} and {@code ALL} mean {@link #ANY}.
   *
   * @param raw filter text
   * @return parsed filter
   * @throws IllegalArgumentException when the text names no filter
   */
  public static EventTypeFilter parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("event type must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("*") || normalized.equals("ALL")) {
      return ANY;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "event type must be one of INSERT, UPDATE, DELETE, TRUNCATE, ANY (was '" + raw + "')", ex);
    }
  }
}
