package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.events.ChangeEvent;

/**
 * <strong>What:</strong> Subscriber callback receiving typed change events.
 * <p><strong>Why:</strong> The engine hands finished events to application code without knowing where they go.</p>
 * <p><strong>Role:</strong> Outbound port implemented by applications and by {@code LoggingChangeEventHandler}.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the stream runner thread, one event at a time; slow handlers slow the
 * stream.</p>
 * <p><strong>Observability:</strong> Exceptions thrown here are logged and counted as
 * {@code dispatch.handler.failure}; the remaining handlers still run.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ChangeEventHandler {
  /**
   * Handles one change event.
   *
   * @param event event to handle; never {@code null}
   * @throws Exception if handling fails
   */
  void handle(ChangeEvent event) throws Exception;
}
