package ca.gc.cra.tide.application.pipeline;

import static ca.gc.cra.tide.testutil.PgOutputFixtures.begin;
import static ca.gc.cra.tide.testutil.PgOutputFixtures.commit;
import static ca.gc.cra.tide.testutil.PgOutputFixtures.insert;
import static ca.gc.cra.tide.testutil.PgOutputFixtures.relation;
import static ca.gc.cra.tide.testutil.PgOutputFixtures.truncate;
import static ca.gc.cra.tide.testutil.PgOutputFixtures.update;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.application.coercion.PgTypes;
import ca.gc.cra.tide.application.coercion.ValueCoercer;
import ca.gc.cra.tide.application.dispatch.ChangeEventDispatcher;
import ca.gc.cra.tide.application.dispatch.EventTypeFilter;
import ca.gc.cra.tide.application.dispatch.SubscriptionRegistry;
import ca.gc.cra.tide.application.dispatch.TablePattern;
import ca.gc.cra.tide.application.events.ChangeEventBuilder;
import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.application.port.DecodeException;
import ca.gc.cra.tide.application.tx.ProtocolSequenceException;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.events.ChangeType;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.infrastructure.events.InMemoryChangeEventHandler;
import ca.gc.cra.tide.infrastructure.protocol.pgoutput.PgOutputMessageDecoder;
import ca.gc.cra.tide.testutil.ManualClock;
import ca.gc.cra.tide.testutil.PgOutputFixtures.Column;
import ca.gc.cra.tide.testutil.PgOutputFixtures.Value;
import ca.gc.cra.tide.testutil.RecordingMetricsPort;
import ca.gc.cra.tide.testutil.ScriptedReplicationSource;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class StreamRunnerTest {
  private static final long MICROS = 767_448_000_000_000L;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ManualClock clock = new ManualClock();
  private final SubscriptionRegistry registry = new SubscriptionRegistry();
  private final InMemoryChangeEventHandler sink = new InMemoryChangeEventHandler();

  @Test
  void deliversCommittedInsertAndAcknowledgesEndPosition() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.parse("public.actors"), sink);
    ScriptedReplicationSource source = actorsTransaction(new ScriptedReplicationSource());

    runner(source, AcknowledgementPolicy.defaults()).run();

    List<ChangeEvent> events = sink.snapshot();
    assertEquals(1, events.size());
    ChangeEvent event = events.get(0);
    assertEquals(ChangeType.INSERT, event.type());
    assertEquals(5L, event.transactionId());
    assertEquals(Map.of("nconst", "nm1", "birthyear", 1990), event.values());
    assertEquals(List.of("nconst"), event.keyColumns());
    assertEquals(PgOutputMessageDecoder.toInstant(MICROS), event.commitTimestamp());
    assertEquals(List.of(Lsn.of(0x230)), source.acknowledged());
    assertTrue(source.started());
    assertTrue(source.closed());
    assertEquals(1, metrics.count("stream.change.dispatched"));
    assertEquals(4, metrics.count("stream.message.received"));
  }

  @Test
  void acknowledgesEveryNMessages() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, sink);
    ScriptedReplicationSource source = actorsTransaction(new ScriptedReplicationSource());

    runner(source, new AcknowledgementPolicy(2, 0L)).run();

    assertEquals(List.of(Lsn.of(0x110), Lsn.of(0x230)), source.acknowledged());
    assertEquals(2, metrics.count("stream.ack.sent"));
  }

  @Test
  void acknowledgesOnIdlePollOnceIntervalElapses() throws Exception {
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .idle()
        .then(() -> clock.advance(1_500))
        .idle();

    StreamRunner runner = runner(source, new AcknowledgementPolicy(100, 1_000L));
    runner.run();

    assertEquals(List.of(Lsn.of(0x100)), source.acknowledged());
    assertEquals(Lsn.of(0x100), runner.position().acknowledged());
  }

  @Test
  void dropsChangesForUnknownRelationsAndContinues() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, sink);
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x108, insert(9, Value.text("orphan")))
        .frame(0x110, actorsRelation())
        .frame(0x120, insert(1, Value.text("nm1"), Value.text("1990")))
        .frame(0x200, commit(0x200, 0x230, MICROS));

    runner(source, AcknowledgementPolicy.defaults()).run();

    assertEquals(1, sink.snapshot().size());
    assertEquals(1, metrics.count("stream.change.unknownRelation"));
    assertEquals(List.of(Lsn.of(0x230)), source.acknowledged());
  }

  @Test
  void skipsTuplesWhoseWidthDoesNotMatchSchema() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, sink);
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, actorsRelation())
        .frame(0x120, insert(1, Value.text("nm1")))
        .frame(0x200, commit(0x200, 0x230, MICROS));

    runner(source, AcknowledgementPolicy.defaults()).run();

    assertTrue(sink.snapshot().isEmpty());
    assertEquals(1, metrics.count("stream.change.schemaMismatch"));
  }

  @Test
  void splitsTruncateIntoOneEventPerRelation() throws Exception {
    registry.register(EventTypeFilter.TRUNCATE, TablePattern.parse("public.*"), sink);
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 6))
        .frame(0x110, actorsRelation())
        .frame(0x118, relation(2, "public", "films", 'd', Column.key("tconst", PgTypes.TEXT)))
        .frame(0x120, truncate(1, 1, 2))
        .frame(0x200, commit(0x200, 0x230, MICROS));

    runner(source, AcknowledgementPolicy.defaults()).run();

    List<ChangeEvent> events = sink.snapshot();
    assertEquals(2, events.size());
    assertEquals("public.actors", events.get(0).qualifiedTable());
    assertEquals("public.films", events.get(1).qualifiedTable());
    assertTrue(events.get(0).values().isEmpty());
    assertEquals(Lsn.of(0x120), events.get(1).position());
  }

  @Test
  void decodeFailureStopsWithoutAcknowledging() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger("test.stream.decode");
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, new byte[] {'Z', 1, 2});
    try {
      StreamRunner runner = new StreamRunner(settings(AcknowledgementPolicy.defaults()), source,
          new PgOutputMessageDecoder(), new ChangeEventBuilder(new ValueCoercer(metrics)),
          new ChangeEventDispatcher(registry, metrics), metrics, clock, logger);

      StreamFailureException ex = assertThrows(StreamFailureException.class, runner::run);

      assertEquals(Lsn.of(0x110), ex.position());
      assertInstanceOf(DecodeException.class, ex.getCause());
      assertTrue(source.acknowledged().isEmpty());
      assertTrue(source.closed());
      assertEquals(1, metrics.count("stream.fatal"));
      assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
          && e.getFormattedMessage().contains("Stopping replication stream for slot slot1")));
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void preservesRowOrderWithinAndCommitOrderAcrossTransactions() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.parse("public.actors"), sink);
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, actorsRelation())
        .frame(0x120, insert(1, Value.text("nm1"), Value.text("1990")))
        .frame(0x130, insert(1, Value.text("nm2"), Value.text("1985")))
        .frame(0x200, commit(0x200, 0x230, MICROS))
        .frame(0x300, begin(0x400, MICROS + 1_000_000, 6))
        .frame(0x310, update(1, Value.text("nm1"), Value.text("1991")))
        .frame(0x400, commit(0x400, 0x430, MICROS + 1_000_000));

    runner(source, AcknowledgementPolicy.defaults()).run();

    List<ChangeEvent> events = sink.snapshot();
    assertEquals(List.of(ChangeType.INSERT, ChangeType.INSERT, ChangeType.UPDATE),
        events.stream().map(ChangeEvent::type).toList());
    assertEquals(List.of("nm1", "nm2", "nm1"), events.stream().map(e -> e.values().get("nconst")).toList());
    assertEquals(List.of(5L, 5L, 6L), events.stream().map(ChangeEvent::transactionId).toList());
    assertEquals(1991, events.get(2).values().get("birthyear"));
    assertEquals(List.of(Lsn.of(0x430)), source.acknowledged());
  }

  @Test
  void closeFailureIsSuppressedBehindFatalError() {
    IOException closeFailure = new IOException("socket reset on close");
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, new byte[] {'Z', 1, 2})
        .failCloseWith(closeFailure);

    StreamFailureException ex = assertThrows(StreamFailureException.class,
        () -> runner(source, AcknowledgementPolicy.defaults()).run());

    assertInstanceOf(DecodeException.class, ex.getCause());
    assertEquals(1, ex.getSuppressed().length);
    assertSame(closeFailure, ex.getSuppressed()[0]);
    assertTrue(source.closed());
  }

  @Test
  void closeFailureAfterCleanRunPropagates() {
    IOException closeFailure = new IOException("socket reset on close");
    ScriptedReplicationSource source = actorsTransaction(new ScriptedReplicationSource())
        .failCloseWith(closeFailure);

    IOException ex = assertThrows(IOException.class, () -> runner(source, AcknowledgementPolicy.defaults()).run());

    assertSame(closeFailure, ex);
    assertEquals(List.of(Lsn.of(0x230)), source.acknowledged());
  }

  @Test
  void handlerErrorIsContainedAndStreamAcknowledges() throws Exception {
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, event -> {
      throw new AssertionError("handler bug");
    });
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, sink);
    ScriptedReplicationSource source = actorsTransaction(new ScriptedReplicationSource());

    runner(source, AcknowledgementPolicy.defaults()).run();

    assertEquals(1, sink.snapshot().size());
    assertEquals(1, metrics.count("dispatch.handler.failure"));
    assertEquals(List.of(Lsn.of(0x230)), source.acknowledged());
  }

  @Test
  void beginInsideOpenTransactionIsFatal() {
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, begin(0x300, MICROS, 6));

    StreamFailureException ex = assertThrows(StreamFailureException.class,
        () -> runner(source, AcknowledgementPolicy.EVERY_MESSAGE).run());

    assertInstanceOf(ProtocolSequenceException.class, ex.getCause());
    assertEquals(List.of(Lsn.of(0x100)), source.acknowledged());
  }

  @Test
  void relationOutsideTransactionIsFatal() {
    ScriptedReplicationSource source = new ScriptedReplicationSource().frame(0x110, actorsRelation());

    StreamFailureException ex = assertThrows(StreamFailureException.class,
        () -> runner(source, AcknowledgementPolicy.defaults()).run());

    assertInstanceOf(ProtocolSequenceException.class, ex.getCause());
  }

  @Test
  void stopFinishesCurrentMessageAndAcknowledges() throws Exception {
    ScriptedReplicationSource source = actorsTransaction(new ScriptedReplicationSource());
    StreamRunner runner = runner(source, AcknowledgementPolicy.defaults());
    ChangeEventHandler stopper = event -> runner.stop();
    registry.register(EventTypeFilter.ANY, TablePattern.ALL, stopper);

    runner.run();

    assertEquals(List.of(Lsn.of(0x120)), source.acknowledged());
    assertEquals(1, source.remaining());
    assertTrue(source.closed());
  }

  @Test
  void commitPositionNeverMovesBackwards() throws Exception {
    ScriptedReplicationSource source = new ScriptedReplicationSource()
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x300, commit(0x200, 0x230, MICROS));

    StreamRunner runner = runner(source, AcknowledgementPolicy.defaults());
    runner.run();

    assertEquals(Lsn.of(0x300), runner.position().processed());
    assertEquals(List.of(Lsn.of(0x300)), source.acknowledged());
  }

  private StreamRunner runner(ScriptedReplicationSource source, AcknowledgementPolicy policy) {
    return new StreamRunner(settings(policy), source, new PgOutputMessageDecoder(),
        new ChangeEventBuilder(new ValueCoercer(metrics)), new ChangeEventDispatcher(registry, metrics),
        metrics, clock);
  }

  private static StreamSettings settings(AcknowledgementPolicy policy) {
    return new StreamSettings("slot1", "pub1", policy);
  }

  private static byte[] actorsRelation() {
    return relation(1, "public", "actors", 'd',
        Column.key("nconst", PgTypes.TEXT), Column.of("birthyear", PgTypes.INT4));
  }

  private static ScriptedReplicationSource actorsTransaction(ScriptedReplicationSource source) {
    return source
        .frame(0x100, begin(0x200, MICROS, 5))
        .frame(0x110, actorsRelation())
        .frame(0x120, insert(1, Value.text("nm1"), Value.text("1990")))
        .frame(0x200, commit(0x200, 0x230, MICROS));
  }
}
