package ca.gc.cra.tide.config;

import ca.gc.cra.tide.application.dispatch.EventTypeFilter;
import ca.gc.cra.tide.application.dispatch.TablePattern;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configured subscription: an event type filter plus a table pattern, written {@code TYPE:schema.table}.
 *
 * <p>The type prefix is optional; {@code public.*} alone subscribes to every change type.</p>
 *
 * @param typeFilter accepted change types
 * @param tablePattern accepted relations
 * @since 0.1.0
 */
public record SubscriptionSpec(EventTypeFilter typeFilter, TablePattern tablePattern) {
  /**
   * Validates constructor invariants.
   */
  public SubscriptionSpec {
    Objects.requireNonNull(typeFilter, "typeFilter");
    Objects.requireNonNull(tablePattern, "tablePattern");
  }

  /**
   * Parses one entry such as {@code UPDATE:public.*} or {@code *.*}.
   *
   * @param text entry text
   * @return parsed spec
   * @throws IllegalArgumentException if the type or the table pattern is malformed
   */
  public static SubscriptionSpec parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("subscription must not be blank");
    }
    String trimmed = text.trim();
    int colon = trimmed.indexOf(':');
    if (colon < 0) {
      return new SubscriptionSpec(EventTypeFilter.ANY, TablePattern.parse(trimmed));
    }
    return new SubscriptionSpec(
        EventTypeFilter.parse(trimmed.substring(0, colon)),
        TablePattern.parse(trimmed.substring(colon + 1)));
  }

  /**
   * Parses a comma separated list of entries.
   *
   * @param text list text; blank yields an empty list
   * @return parsed specs in order
   * @throws IllegalArgumentException if any entry is malformed
   */
  public static List<SubscriptionSpec> parseList(String text) {
    List<SubscriptionSpec> specs = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return List.of();
    }
    for (String token : text.split(",")) {
      if (!token.isBlank()) {
        specs.add(parse(token));
      }
    }
    return List.copyOf(specs);
  }

  @Override
  public String toString() {
    return typeFilter + ":" + tablePattern;
  }
}
