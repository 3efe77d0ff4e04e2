package ca.gc.cra.tide.infrastructure.events;

import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.logging.Logs;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one structured log line per change event and increments a per-type counter.
 *
 * <p>Line shape: {@code change.event 2024-05-01T10:00:00Z id:812 [UPDATE] public.actors with values [...]}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingChangeEventHandler implements ChangeEventHandler {
  private static final Logger log = LoggerFactory.getLogger(LoggingChangeEventHandler.class);
  private static final int DEFAULT_MAX_VALUE_BYTES = 256;

  private final MetricsPort metrics;
  private final String metricPrefix;
  private final int maxValueBytes;

  /**
   * Creates a logging handler.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code events})
   * @param maxValueBytes UTF-8 budget per logged column value; must be positive
   */
  public LoggingChangeEventHandler(MetricsPort metrics, String metricPrefix, int maxValueBytes) {
    if (maxValueBytes <= 0) {
      throw new IllegalArgumentException("maxValueBytes must be positive");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "events" : metricPrefix.trim();
    this.maxValueBytes = maxValueBytes;
  }

  /**
   * Creates a logging handler with the {@code events} prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingChangeEventHandler(MetricsPort metrics) {
    this(metrics, "events", DEFAULT_MAX_VALUE_BYTES);
  }

  @Override
  public void handle(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + "." + event.type().name().toLowerCase(Locale.ROOT) + ".emitted");

    if (event.oldValues().isPresent()) {
      log.info("change.event {} id:{} [{}] {} with values {} previously {}",
          event.commitTimestamp(),
          event.transactionId(),
          event.type(),
          event.qualifiedTable(),
          format(event.values()),
          format(event.oldValues().get()));
    } else {
      log.info("change.event {} id:{} [{}] {} with values {}",
          event.commitTimestamp(),
          event.transactionId(),
          event.type(),
          event.qualifiedTable(),
          format(event.values()));
    }
  }

  private String format(Map<String, Object> values) {
    StringJoiner joiner = new StringJoiner("; ", "[", "]");
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      Object value = entry.getValue();
      String rendered = value instanceof byte[] bytes ? "<" + bytes.length + " bytes>" : String.valueOf(value);
      joiner.add(entry.getKey() + '=' + Logs.truncate(rendered, maxValueBytes));
    }
    return joiner.toString();
  }
}
