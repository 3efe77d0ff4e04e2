package ca.gc.cra.tide.testutil;

import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.events.ChangeType;
import ca.gc.cra.tide.domain.replication.Lsn;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canned change events for dispatch and handler tests.
 */
public final class TestEvents {
  private TestEvents() {}

  public static ChangeEvent event(ChangeType type, String schema, String table, Map<String, Object> values) {
    return new ChangeEvent(Instant.parse("2024-05-01T12:00:00Z"), 5L, type, schema, table, values,
        Optional.empty(), List.of(), Lsn.of(0x1000));
  }

  public static ChangeEvent insert(String schema, String table) {
    return event(ChangeType.INSERT, schema, table, Map.of("id", 1));
  }
}
