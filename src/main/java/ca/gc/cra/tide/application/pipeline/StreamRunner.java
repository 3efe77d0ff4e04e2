package ca.gc.cra.tide.application.pipeline;

import ca.gc.cra.tide.application.dispatch.ChangeEventDispatcher;
import ca.gc.cra.tide.application.events.ChangeEventBuilder;
import ca.gc.cra.tide.application.events.SchemaMismatchException;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.FatalReplicationException;
import ca.gc.cra.tide.application.port.MessageDecoder;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.port.ReplicationSource;
import ca.gc.cra.tide.application.schema.RelationCache;
import ca.gc.cra.tide.application.schema.UnknownRelationException;
import ca.gc.cra.tide.application.tx.TransactionTracker;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.protocol.pgoutput.BeginMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.CommitMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.PgOutputMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.RawChange;
import ca.gc.cra.tide.domain.protocol.pgoutput.RelationMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.TruncateMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.TruncatedRelation;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.replication.ReplicationFrame;
import ca.gc.cra.tide.domain.replication.TransactionContext;
import ca.gc.cra.tide.domain.schema.RelationSchema;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives one replication stream: receive, decode, route, dispatch, acknowledge.
 * <p><strong>Why:</strong> Keeps strict log order from the source to subscribers and reports progress upstream so the
 * server can release retained log.</p>
 * <p><strong>Role:</strong> Application-layer use case on the consuming side of the hexagonal architecture.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Start and close the replication source.</li>
 *   <li>Route Begin/Commit to the transaction tracker and Relation to the relation cache.</li>
 *   <li>Build and dispatch one event per row change; split truncations per relation.</li>
 *   <li>Advance the processed position after every message and acknowledge per {@link AcknowledgementPolicy}.</li>
 *   <li>Stop on fatal errors with {@link StreamFailureException}; drop and count recoverable ones.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} executes on one thread; {@link #stop()} may be called from any
 * thread and takes effect before the next receive.</p>
 * <p><strong>Performance:</strong> Handlers run inline; a slow handler delays the next receive and acknowledgment.</p>
 * <p><strong>Observability:</strong> Increments {@code stream.message.received}, {@code stream.message.<tag>},
 * {@code stream.change.dispatched}, {@code stream.change.unknownRelation}, {@code stream.change.schemaMismatch},
 * {@code stream.ack.sent}, {@code stream.fatal}; records {@code stream.dispatch.latencyNanos}.</p>
 *
 * @implNote Commit messages advance the position to the commit's end position so an acknowledgment covers the whole
 * transaction. Acknowledgment always follows processing, giving at-least-once delivery.
 * @since 0.1.0
 */
public final class StreamRunner {
  private final StreamSettings settings;
  private final ReplicationSource source;
  private final MessageDecoder decoder;
  private final ChangeEventBuilder eventBuilder;
  private final ChangeEventDispatcher dispatcher;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Logger log;

  private final RelationCache relations = new RelationCache();
  private final TransactionTracker transactions = new TransactionTracker();
  private final StreamPosition position = new StreamPosition();
  private volatile boolean stopRequested;

  /**
   * Creates a runner logging under {@code ca.gc.cra.tide.application.pipeline.StreamRunner.<slot>}.
   *
   * @param settings stream settings; must not be {@code null}
   * @param source replication source; must not be {@code null}
   * @param decoder message decoder; must not be {@code null}
   * @param eventBuilder change event builder; must not be {@code null}
   * @param dispatcher event dispatcher; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock for acknowledgment intervals; must not be {@code null}
   */
  public StreamRunner(
      StreamSettings settings,
      ReplicationSource source,
      MessageDecoder decoder,
      ChangeEventBuilder eventBuilder,
      ChangeEventDispatcher dispatcher,
      MetricsPort metrics,
      ClockPort clock) {
    this(settings, source, decoder, eventBuilder, dispatcher, metrics, clock,
        LoggerFactory.getLogger(StreamRunner.class.getName() + "." + settings.slotName()));
  }

  /**
   * Creates a runner with an explicit logger.
   *
   * @param settings stream settings; must not be {@code null}
   * @param source replication source; must not be {@code null}
   * @param decoder message decoder; must not be {@code null}
   * @param eventBuilder change event builder; must not be {@code null}
   * @param dispatcher event dispatcher; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock for acknowledgment intervals; must not be {@code null}
   * @param log logger receiving lifecycle and error logs; must not be {@code null}
   */
  public StreamRunner(
      StreamSettings settings,
      ReplicationSource source,
      MessageDecoder decoder,
      ChangeEventBuilder eventBuilder,
      ChangeEventDispatcher dispatcher,
      MetricsPort metrics,
      ClockPort clock,
      Logger log) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.eventBuilder = Objects.requireNonNull(eventBuilder, "eventBuilder");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Runs the stream until {@link #stop()} is called, the thread is interrupted, or the source is exhausted.
   *
   * @throws StreamFailureException when a decode or protocol error makes the stream untrustworthy
   * @throws Exception if the source fails to start, receive, acknowledge, or close; a close failure after
   *     another failure is attached to it as suppressed
   *
   * <p><strong>Concurrency:</strong> Single-threaded; checks the stop flag and interrupt status before each receive.</p>
   * <p><strong>Observability:</strong> Logs start, stop, and final position at INFO.</p>
   */
  public void run() throws Exception {
    boolean started = false;
    long processedCount = 0;
    Throwable failure = null;
    try {
      source.start();
      started = true;
      position.resetTimer(clock.nowMillis());
      log.info("Replication stream started for slot {} publication {}",
          settings.slotName(), settings.publicationName());

      while (!stopRequested && !Thread.currentThread().isInterrupted()) {
        ReplicationFrame frame;
        try {
          Optional<ReplicationFrame> maybeFrame = source.receive();
          if (maybeFrame.isEmpty()) {
            if (source.isExhausted()) {
              log.info("Replication source exhausted; stopping stream loop");
              break;
            }
            acknowledgeIfDue();
            continue;
          }
          frame = maybeFrame.get();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.info("Stream loop interrupted; acknowledging and shutting down");
          break;
        }

        metrics.increment("stream.message.received");
        Lsn processedUpTo;
        try {
          processedUpTo = process(frame);
        } catch (FatalReplicationException ex) {
          metrics.increment("stream.fatal");
          log.error("Stopping replication stream for slot {} at {}: {}",
              settings.slotName(), frame.position(), ex.getMessage());
          throw new StreamFailureException(frame.position(), ex);
        }
        position.advance(processedUpTo);
        processedCount++;
        acknowledgeIfDue();
      }

      if (position.hasUnacknowledged()) {
        acknowledge();
      }
    } catch (Exception | Error ex) {
      failure = ex;
      throw ex;
    } finally {
      log.info("Replication stream for slot {} processed {} messages; last acknowledged {}",
          settings.slotName(), processedCount, position.acknowledged());
      if (started) {
        try {
          source.close();
          log.info("Replication source closed");
        } catch (Exception ex) {
          log.error("Failed to close replication source", ex);
          if (failure == null) {
            throw ex;
          }
          failure.addSuppressed(ex);
        }
      }
    }
  }

  /**
   * Requests a cooperative stop; the in-flight message completes first.
   */
  public void stop() {
    stopRequested = true;
  }

  /**
   * Returns the processed and acknowledged positions.
   *
   * @return live position tracker
   */
  public StreamPosition position() {
    return position;
  }

  RelationCache relations() {
    return relations;
  }

  TransactionTracker transactions() {
    return transactions;
  }

  private Lsn process(ReplicationFrame frame) {
    PgOutputMessage message = decoder.decode(frame.payload());
    metrics.increment("stream.message." + message.tag().name().toLowerCase(Locale.ROOT));
    Lsn at = frame.position();
    switch (message.tag()) {
      case BEGIN -> transactions.begin((BeginMessage) message);
      case COMMIT -> {
        CommitMessage commit = (CommitMessage) message;
        transactions.commit(commit);
        return at.max(commit.endLsn());
      }
      case RELATION -> {
        transactions.require("Relation");
        relations.update(((RelationMessage) message).schema());
      }
      case TYPE, ORIGIN -> {
        transactions.require(message.tag().name());
        log.debug("Skipping {} at {}", message, at);
      }
      case INSERT, UPDATE, DELETE -> handleChange((RawChange) message, at);
      case TRUNCATE -> {
        for (TruncatedRelation part : ((TruncateMessage) message).split()) {
          handleChange(part, at);
        }
      }
    }
    return at;
  }

  private void handleChange(RawChange change, Lsn at) {
    TransactionContext transaction = transactions.require(change.getClass().getSimpleName());
    ChangeEvent event;
    try {
      RelationSchema schema = relations.resolve(change.relationId());
      event = eventBuilder.build(change, schema, transaction, at);
    } catch (UnknownRelationException ex) {
      metrics.increment("stream.change.unknownRelation");
      log.error("Dropping change at {} in tx {}: {}", at, transaction.transactionId(), ex.getMessage());
      return;
    } catch (SchemaMismatchException ex) {
      metrics.increment("stream.change.schemaMismatch");
      log.error("Skipping change at {} in tx {}: {}", at, transaction.transactionId(), ex.getMessage());
      return;
    }

    long startNanos = System.nanoTime();
    dispatcher.dispatch(event);
    metrics.observe("stream.dispatch.latencyNanos", System.nanoTime() - startNanos);
    metrics.increment("stream.change.dispatched");
  }

  private void acknowledgeIfDue() throws Exception {
    long now = clock.nowMillis();
    if (settings.acknowledgement().isDue(position.pendingMessages(), now - position.lastAcknowledgedAtMillis())) {
      acknowledge();
    }
  }

  private void acknowledge() throws Exception {
    Lsn target = position.processed();
    source.acknowledge(target);
    position.markAcknowledged(clock.nowMillis());
    metrics.increment("stream.ack.sent");
    log.debug("Acknowledged {}", target);
  }
}
