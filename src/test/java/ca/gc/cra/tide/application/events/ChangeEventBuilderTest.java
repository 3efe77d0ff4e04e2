package ca.gc.cra.tide.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.application.coercion.PgTypes;
import ca.gc.cra.tide.application.coercion.ValueCoercer;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.events.ChangeType;
import ca.gc.cra.tide.domain.events.UnchangedToast;
import ca.gc.cra.tide.domain.protocol.pgoutput.DeleteMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.InsertMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.OldTuple;
import ca.gc.cra.tide.domain.protocol.pgoutput.TruncatedRelation;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleData;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleField;
import ca.gc.cra.tide.domain.protocol.pgoutput.UpdateMessage;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.replication.TransactionContext;
import ca.gc.cra.tide.domain.schema.ColumnDescriptor;
import ca.gc.cra.tide.domain.schema.RelationSchema;
import ca.gc.cra.tide.domain.schema.ReplicaIdentity;
import ca.gc.cra.tide.testutil.RecordingMetricsPort;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChangeEventBuilderTest {
  private static final Instant COMMIT_TS = Instant.parse("2024-05-01T12:00:00Z");
  private static final TransactionContext TX = new TransactionContext(5L, Lsn.of(0x500), COMMIT_TS);
  private static final RelationSchema ACTORS = new RelationSchema(1, "public", "actors", ReplicaIdentity.DEFAULT,
      List.of(
          new ColumnDescriptor("nconst", PgTypes.TEXT, -1, true),
          new ColumnDescriptor("birthyear", PgTypes.INT4, -1, false),
          new ColumnDescriptor("bio", PgTypes.TEXT, -1, false)));

  private final ChangeEventBuilder builder = new ChangeEventBuilder(new ValueCoercer(new RecordingMetricsPort()));

  @Test
  void insertCarriesTypedValuesInColumnOrder() {
    InsertMessage insert = new InsertMessage(1, tuple(TupleField.text("nm1"), TupleField.text("1990"), TupleField.NULL));

    ChangeEvent event = builder.build(insert, ACTORS, TX, Lsn.of(0x4F0));

    assertEquals(ChangeType.INSERT, event.type());
    assertEquals("public", event.schema());
    assertEquals("actors", event.table());
    assertEquals(5L, event.transactionId());
    assertEquals(COMMIT_TS, event.commitTimestamp());
    assertEquals(Lsn.of(0x4F0), event.position());
    assertEquals(List.of("nconst", "birthyear", "bio"), List.copyOf(event.values().keySet()));
    assertEquals("nm1", event.values().get("nconst"));
    assertEquals(1990, event.values().get("birthyear"));
    assertNull(event.values().get("bio"));
    assertEquals(List.of("nconst"), event.keyColumns());
    assertTrue(event.oldValues().isEmpty());
  }

  @Test
  void updateWithKeyImageKeepsOnlyKeyColumns() {
    UpdateMessage update = new UpdateMessage(1,
        Optional.of(new OldTuple(OldTuple.Kind.KEY, tuple(TupleField.text("nm0"), TupleField.NULL, TupleField.NULL))),
        tuple(TupleField.text("nm1"), TupleField.text("1991"), TupleField.UNCHANGED_TOAST));

    ChangeEvent event = builder.build(update, ACTORS, TX, Lsn.of(0x4F0));

    assertEquals(ChangeType.UPDATE, event.type());
    assertEquals(Map.of("nconst", "nm0"), event.oldValues().orElseThrow());
    assertSame(UnchangedToast.VALUE, event.values().get("bio"));
  }

  @Test
  void updateWithFullImageKeepsEveryColumn() {
    UpdateMessage update = new UpdateMessage(1,
        Optional.of(new OldTuple(OldTuple.Kind.FULL,
            tuple(TupleField.text("nm1"), TupleField.text("1990"), TupleField.text("old")))),
        tuple(TupleField.text("nm1"), TupleField.text("1991"), TupleField.text("new")));

    ChangeEvent event = builder.build(update, ACTORS, TX, Lsn.of(0x4F0));

    Map<String, Object> old = event.oldValues().orElseThrow();
    assertEquals(3, old.size());
    assertEquals(1990, old.get("birthyear"));
    assertEquals("new", event.values().get("bio"));
  }

  @Test
  void updateWithoutOldImageHasNoOldValues() {
    UpdateMessage update = new UpdateMessage(1, Optional.empty(),
        tuple(TupleField.text("nm1"), TupleField.text("1991"), TupleField.NULL));

    assertTrue(builder.build(update, ACTORS, TX, Lsn.of(1)).oldValues().isEmpty());
  }

  @Test
  void deleteUsesOldImageAsValues() {
    DeleteMessage delete = new DeleteMessage(1,
        new OldTuple(OldTuple.Kind.KEY, tuple(TupleField.text("nm1"), TupleField.NULL, TupleField.NULL)));

    ChangeEvent event = builder.build(delete, ACTORS, TX, Lsn.of(1));

    assertEquals(ChangeType.DELETE, event.type());
    assertEquals("nm1", event.values().get("nconst"));
    assertEquals(3, event.values().size());
  }

  @Test
  void truncateHasNoValues() {
    ChangeEvent event = builder.build(new TruncatedRelation(1, true, false), ACTORS, TX, Lsn.of(1));

    assertEquals(ChangeType.TRUNCATE, event.type());
    assertTrue(event.values().isEmpty());
    assertEquals("public.actors", event.qualifiedTable());
  }

  @Test
  void tupleWidthMismatchIsRejected() {
    InsertMessage insert = new InsertMessage(1, tuple(TupleField.text("nm1")));

    SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
        () -> builder.build(insert, ACTORS, TX, Lsn.of(1)));
    assertTrue(ex.getMessage().contains("public.actors"), ex.getMessage());
  }

  private static TupleData tuple(TupleField... fields) {
    return new TupleData(List.of(fields));
  }
}
