package ca.gc.cra.tide.application.pipeline;

import ca.gc.cra.tide.application.coercion.ValueCoercer;
import ca.gc.cra.tide.application.dispatch.ChangeEventDispatcher;
import ca.gc.cra.tide.application.dispatch.EventTypeFilter;
import ca.gc.cra.tide.application.dispatch.Subscription;
import ca.gc.cra.tide.application.dispatch.SubscriptionRegistry;
import ca.gc.cra.tide.application.dispatch.TablePattern;
import ca.gc.cra.tide.application.events.ChangeEventBuilder;
import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.MessageDecoder;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.port.ReplicationSource;
import ca.gc.cra.tide.application.port.ReplicationSourceFactory;
import ca.gc.cra.tide.domain.events.ChangeType;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Subscriber-facing entry point: register handlers, then stream a slot.
 * <p><strong>Why:</strong> Applications describe what they want ({@code UPDATE} on {@code public.*}) and leave
 * decoding, schema tracking, and acknowledgment to the engine.</p>
 * <p><strong>Role:</strong> Application facade composing the registry, dispatcher, and one {@link StreamRunner} per
 * {@link #start(String, String)} call.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect subscriptions before streaming; reject them afterwards.</li>
 *   <li>Open a replication source for the slot and publication and run it to completion.</li>
 *   <li>Forward {@link #stop()} to the active runner.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Subscribe on one thread before {@code start}; {@link #stop()} may be called from
 * any thread.</p>
 * <p><strong>Observability:</strong> Logs subscription counts and stream start/stop.</p>
 *
 * @since 0.1.0
 */
public final class ReplicationConsumer {
  private static final Logger log = LoggerFactory.getLogger(ReplicationConsumer.class);

  private final ReplicationSourceFactory sourceFactory;
  private final MessageDecoder decoder;
  private final AcknowledgementPolicy acknowledgement;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SubscriptionRegistry registry = new SubscriptionRegistry();
  private volatile StreamRunner activeRunner;
  private volatile boolean stopRequested;

  /**
   * Creates a consumer.
   *
   * @param sourceFactory opens replication sources; must not be {@code null}
   * @param decoder message decoder; must not be {@code null}
   * @param acknowledgement acknowledgment cadence; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock for acknowledgment intervals; must not be {@code null}
   */
  public ReplicationConsumer(
      ReplicationSourceFactory sourceFactory,
      MessageDecoder decoder,
      AcknowledgementPolicy acknowledgement,
      MetricsPort metrics,
      ClockPort clock) {
    this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.acknowledgement = Objects.requireNonNull(acknowledgement, "acknowledgement");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Subscribes a handler to one change type on relations matching {@code tablePattern}.
   *
   * @param type change type
   * @param tablePattern {@code schema.table} pattern, either segment may be {@code *}
   * @param handler callback
   * @return this consumer
   * @throws IllegalStateException once streaming has started
   */
  public ReplicationConsumer on(ChangeType type, String tablePattern, ChangeEventHandler handler) {
    Objects.requireNonNull(type, "type");
    registry.register(EventTypeFilter.of(type), TablePattern.parse(tablePattern), handler);
    return this;
  }

  /**
   * Subscribes a handler to every change type on relations matching {@code tablePattern}.
   *
   * @param tablePattern {@code schema.table} pattern
   * @param handler callback
   * @return this consumer
   * @throws IllegalStateException once streaming has started
   */
  public ReplicationConsumer onAll(String tablePattern, ChangeEventHandler handler) {
    registry.registerAll(TablePattern.parse(tablePattern), handler);
    return this;
  }

  /**
   * Registers a subscription with explicit filters.
   *
   * @param typeFilter accepted change types
   * @param tablePattern accepted relations
   * @param handler callback
   * @return registered subscription
   * @throws IllegalStateException once streaming has started
   */
  public Subscription subscribe(EventTypeFilter typeFilter, TablePattern tablePattern, ChangeEventHandler handler) {
    return registry.register(typeFilter, tablePattern, handler);
  }

  /**
   * Returns registered subscriptions in registration order.
   *
   * @return subscription snapshot
   */
  public List<Subscription> subscriptions() {
    return registry.subscriptions();
  }

  /**
   * Streams {@code publicationName} changes from {@code slotName} until stopped, interrupted, or failed.
   *
   * <p>A {@link #stop()} applies to the active run, or to the next one when none is active; once a run ends the
   * consumer can be started again.</p>
   *
   * @param slotName existing logical replication slot
   * @param publicationName existing publication
   * @throws StreamFailureException when a fatal decode or protocol error stops the stream
   * @throws IllegalStateException when a stream is already running on this consumer
   * @throws Exception if the source cannot be opened or fails
   */
  public void start(String slotName, String publicationName) throws Exception {
    StreamSettings settings = new StreamSettings(slotName, publicationName, acknowledgement);
    registry.freeze();
    if (registry.size() == 0) {
      log.warn("Starting slot {} without subscriptions; changes will be acknowledged but not delivered", slotName);
    }

    ReplicationSource source = sourceFactory.open(settings.slotName(), settings.publicationName());
    StreamRunner runner = new StreamRunner(
        settings,
        source,
        decoder,
        new ChangeEventBuilder(new ValueCoercer(metrics)),
        new ChangeEventDispatcher(registry, metrics),
        metrics,
        clock);
    synchronized (this) {
      if (activeRunner != null) {
        source.close();
        throw new IllegalStateException("consumer is already streaming");
      }
      activeRunner = runner;
      if (stopRequested) {
        runner.stop();
      }
    }

    log.info("Streaming slot {} publication {} to {} subscriptions",
        settings.slotName(), settings.publicationName(), registry.size());
    try {
      runner.run();
    } finally {
      synchronized (this) {
        activeRunner = null;
        stopRequested = false;
      }
    }
  }

  /**
   * Requests a cooperative stop of the active stream, or of the next one if none is running yet.
   * The request is cleared when that run ends.
   */
  public synchronized void stop() {
    stopRequested = true;
    StreamRunner runner = activeRunner;
    if (runner != null) {
      runner.stop();
    }
  }
}
