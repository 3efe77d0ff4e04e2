package ca.gc.cra.tide.application.events;

import ca.gc.cra.tide.application.coercion.ValueCoercer;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.events.ChangeType;
import ca.gc.cra.tide.domain.protocol.pgoutput.DeleteMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.InsertMessage;
import ca.gc.cra.tide.domain.protocol.pgoutput.OldTuple;
import ca.gc.cra.tide.domain.protocol.pgoutput.RawChange;
import ca.gc.cra.tide.domain.protocol.pgoutput.TruncatedRelation;
import ca.gc.cra.tide.domain.protocol.pgoutput.TupleData;
import ca.gc.cra.tide.domain.protocol.pgoutput.UpdateMessage;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.replication.TransactionContext;
import ca.gc.cra.tide.domain.schema.ColumnDescriptor;
import ca.gc.cra.tide.domain.schema.RelationSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns a positional {@link RawChange} into a named, typed {@link ChangeEvent}.
 * <p><strong>Why:</strong> Combines the relation schema (names, types), the open transaction (id, commit time), and
 * the value coercer in one place so the stream runner only routes.</p>
 * <p><strong>Role:</strong> Application service invoked once per row change.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Zip tuple fields with schema columns by position, preserving column order.</li>
 *   <li>Select the new tuple for inserts and updates, the old tuple for deletes, and nothing for truncations.</li>
 *   <li>Attach old values on updates only when the server sent an old-row image.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ChangeEventBuilder {
  private final ValueCoercer coercer;

  /**
   * Creates a builder.
   *
   * @param coercer value coercer; must not be {@code null}
   */
  public ChangeEventBuilder(ValueCoercer coercer) {
    this.coercer = Objects.requireNonNull(coercer, "coercer");
  }

  /**
   * Builds the event for one change.
   *
   * @param change positional change; never {@code null}
   * @param schema current schema of the changed relation; never {@code null}
   * @param transaction open transaction; never {@code null}
   * @param position log position of the originating message; never {@code null}
   * @return typed event
   * @throws SchemaMismatchException when a tuple's width differs from the schema
   */
  public ChangeEvent build(RawChange change, RelationSchema schema, TransactionContext transaction, Lsn position) {
    Objects.requireNonNull(change, "change");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(transaction, "transaction");
    Objects.requireNonNull(position, "position");

    ChangeType type;
    Map<String, Object> values;
    Optional<Map<String, Object>> oldValues = Optional.empty();
    if (change instanceof InsertMessage insert) {
      type = ChangeType.INSERT;
      values = zip(schema, insert.newTuple(), false);
    } else if (change instanceof UpdateMessage update) {
      type = ChangeType.UPDATE;
      values = zip(schema, update.newTuple(), false);
      if (update.oldTuple().isPresent()) {
        OldTuple old = update.oldTuple().get();
        oldValues = Optional.of(zip(schema, old.data(), old.kind() == OldTuple.Kind.KEY));
      }
    } else if (change instanceof DeleteMessage delete) {
      type = ChangeType.DELETE;
      values = zip(schema, delete.oldTuple().data(), false);
    } else if (change instanceof TruncatedRelation) {
      type = ChangeType.TRUNCATE;
      values = Map.of();
    } else {
      throw new IllegalArgumentException("unsupported change " + change.getClass().getName());
    }

    return new ChangeEvent(
        transaction.commitTimestamp(),
        transaction.transactionId(),
        type,
        schema.namespace(),
        schema.name(),
        values,
        oldValues,
        schema.keyColumnNames(),
        position);
  }

  private Map<String, Object> zip(RelationSchema schema, TupleData tuple, boolean keyColumnsOnly) {
    List<ColumnDescriptor> columns = schema.columns();
    if (tuple.size() != columns.size()) {
      throw new SchemaMismatchException(schema.qualifiedName(), columns.size(), tuple.size());
    }
    Map<String, Object> values = new LinkedHashMap<>(columns.size() * 2);
    for (int i = 0; i < columns.size(); i++) {
      ColumnDescriptor column = columns.get(i);
      if (keyColumnsOnly && !column.key()) {
        continue;
      }
      values.put(column.name(), coercer.coerce(column.typeOid(), tuple.get(i)));
    }
    return values;
  }
}
