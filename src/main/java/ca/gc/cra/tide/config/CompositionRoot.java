package ca.gc.cra.tide.config;

import ca.gc.cra.tide.application.pipeline.ReplicationConsumer;
import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.MessageDecoder;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.port.ReplicationSourceFactory;
import ca.gc.cra.tide.infrastructure.events.LoggingChangeEventHandler;
import ca.gc.cra.tide.infrastructure.protocol.pgoutput.PgOutputMessageDecoder;
import ca.gc.cra.tide.infrastructure.replication.PgReplicationSourceFactory;
import ca.gc.cra.tide.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link ReplicationConsumer} from a {@link StreamConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the CLI and tests build the same graph.</p>
 * <p><strong>Role:</strong> Composition root binding the PgJDBC source, the {@code pgoutput} decoder, the system
 * clock and the configured logging subscriptions to the application core.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 * <p><strong>Observability:</strong> The metrics port supplied here is shared by every component of the graph.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final StreamConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root using the system clock.
   *
   * @param config stream configuration; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public CompositionRoot(StreamConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  /**
   * Creates a composition root with an explicit clock.
   *
   * @param config stream configuration; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock driving acknowledgment intervals; must not be {@code null}
   */
  public CompositionRoot(StreamConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a consumer reading from PostgreSQL with one logging handler per configured subscription.
   *
   * @return consumer ready for {@link ReplicationConsumer#start(String, String)}
   */
  public ReplicationConsumer replicationConsumer() {
    return replicationConsumer(sourceFactory());
  }

  /**
   * Builds a consumer reading from the supplied source factory.
   *
   * @param sourceFactory replication source factory; must not be {@code null}
   * @return consumer with the configured logging subscriptions registered
   */
  public ReplicationConsumer replicationConsumer(ReplicationSourceFactory sourceFactory) {
    ReplicationConsumer consumer = new ReplicationConsumer(
        Objects.requireNonNull(sourceFactory, "sourceFactory"),
        messageDecoder(),
        config.acknowledgement(),
        metrics,
        clock);
    ChangeEventHandler handler = new LoggingChangeEventHandler(metrics, "events", config.logValueBytes());
    for (SubscriptionSpec spec : config.subscriptions()) {
      consumer.subscribe(spec.typeFilter(), spec.tablePattern(), handler);
      log.debug("Registered logging subscription {}", spec);
    }
    return consumer;
  }

  /**
   * Returns the PgJDBC source factory for the configured connection and start position.
   *
   * @return source factory
   */
  public ReplicationSourceFactory sourceFactory() {
    return new PgReplicationSourceFactory(config.connection(), config.startLsn());
  }

  /**
   * Returns the {@code pgoutput} decoder.
   *
   * @return decoder instance
   */
  public MessageDecoder messageDecoder() {
    return new PgOutputMessageDecoder();
  }

  /**
   * Returns the shared metrics port.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return stream configuration
   */
  public StreamConfig config() {
    return config;
  }
}
