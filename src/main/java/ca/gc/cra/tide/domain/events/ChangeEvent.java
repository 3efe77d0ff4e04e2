package ca.gc.cra.tide.domain.events;

import ca.gc.cra.tide.domain.replication.Lsn;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed row change delivered to subscribers.
 * <p><strong>Why:</strong> Subscribers work with named, coerced column values instead of positional wire tuples.</p>
 * <p><strong>Role:</strong> Domain event produced by {@code ChangeEventBuilder} and consumed by handlers.</p>
 * <p><strong>Thread-safety:</strong> Immutable. Value maps preserve column order and may contain {@code null} values
 * (SQL null) and {@link UnchangedToast#VALUE} (value not resent).</p>
 *
 * @param commitTimestamp commit time of the enclosing transaction; never {@code null}
 * @param transactionId enclosing transaction id
 * @param type change kind; never {@code null}
 * @param schema schema (namespace) name; never {@code null}
 * @param table table name; never {@code null}
 * @param values column name to value, in column order; empty for truncations
 * @param oldValues previous values when the server sent an old-row image on update; empty otherwise
 * @param keyColumns replica identity key columns of the relation, in column order
 * @param position log position of the message that produced this event; never {@code null}
 * @since 0.1.0
 */
public record ChangeEvent(
    Instant commitTimestamp,
    long transactionId,
    ChangeType type,
    String schema,
    String table,
    Map<String, Object> values,
    Optional<Map<String, Object>> oldValues,
    List<String> keyColumns,
    Lsn position) {

  /**
   * Validates constructor invariants and copies value maps, keeping their iteration order.
   */
  public ChangeEvent {
    commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
    type = Objects.requireNonNull(type, "type");
    schema = Objects.requireNonNull(schema, "schema");
    table = Objects.requireNonNull(table, "table");
    position = Objects.requireNonNull(position, "position");
    values = orderedCopy(values);
    oldValues = oldValues == null ? Optional.empty() : oldValues.map(ChangeEvent::orderedCopy);
    keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
  }

  /**
   * Returns the {@code schema.table} name of the changed relation.
   *
   * @return qualified relation name
   */
  public String qualifiedTable() {
    return schema + '.' + table;
  }

  private static Map<String, Object> orderedCopy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
