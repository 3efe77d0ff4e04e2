package ca.gc.cra.tide.infrastructure.events;

import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory handler used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryChangeEventHandler implements ChangeEventHandler {
  private final CopyOnWriteArrayList<ChangeEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void handle(ChangeEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of handled events.
   *
   * @return immutable list of events in delivery order
   */
  public List<ChangeEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
