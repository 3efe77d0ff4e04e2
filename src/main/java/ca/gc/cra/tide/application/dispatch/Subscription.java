package ca.gc.cra.tide.application.dispatch;

import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import java.util.Objects;

/**
 * Pairing of an event filter with the handler it feeds.
 *
 * @param typeFilter accepted event types
 * @param tablePattern accepted relations
 * @param handler callback receiving matching events
 * @since 0.1.0
 */
public record Subscription(EventTypeFilter typeFilter, TablePattern tablePattern, ChangeEventHandler handler) {
  /**
   * Validates constructor invariants.
   */
  public Subscription {
    typeFilter = Objects.requireNonNull(typeFilter, "typeFilter");
    tablePattern = Objects.requireNonNull(tablePattern, "tablePattern");
    handler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Tests an event against both filters.
   *
   * @param event candidate event
   * @return {@code true} when type and relation match
   */
  public boolean matches(ChangeEvent event) {
    return typeFilter.matches(event.type()) && tablePattern.matches(event.schema(), event.table());
  }

  /**
   * Renders the filter as {@code TYPE:schema.table}.
   *
   * @return filter description
   */
  public String describe() {
    return typeFilter + ":" + tablePattern;
  }
}
