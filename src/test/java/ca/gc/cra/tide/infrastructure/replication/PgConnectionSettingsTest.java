package ca.gc.cra.tide.infrastructure.replication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class PgConnectionSettingsTest {
  @Test
  void buildsJdbcUrl() {
    PgConnectionSettings settings = new PgConnectionSettings("db.internal", 5433, "imdb", "repl", "", 100, 10_000);

    assertEquals("jdbc:postgresql://db.internal:5433/imdb", settings.jdbcUrl());
  }

  @Test
  void bracketsIpv6Hosts() {
    PgConnectionSettings settings = new PgConnectionSettings("::1", 5432, "imdb", "repl", "", 100, 10_000);

    assertEquals("jdbc:postgresql://[::1]:5432/imdb", settings.jdbcUrl());
  }

  @Test
  void replicationPropertiesRequestDatabaseReplication() {
    Properties props = new PgConnectionSettings("db", 5432, "imdb", "repl", "pw", 100, 10_000).replicationProperties();

    assertEquals("repl", props.getProperty("user"));
    assertEquals("pw", props.getProperty("password"));
    assertEquals("database", props.getProperty("replication"));
    assertEquals("simple", props.getProperty("preferQueryMode"));
  }

  @Test
  void blankPasswordIsNotSent() {
    Properties props = new PgConnectionSettings("db", 5432, "imdb", "repl", "", 100, 10_000).replicationProperties();

    assertFalse(props.containsKey("password"));
  }

  @Test
  void toStringRedactsPassword() {
    String rendered = new PgConnectionSettings("db", 5432, "imdb", "repl", "hunter2", 100, 10_000).toString();

    assertTrue(rendered.contains("repl@db:5432/imdb"), rendered);
    assertTrue(rendered.contains("[REDACTED]"), rendered);
    assertFalse(rendered.contains("hunter2"), rendered);
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new PgConnectionSettings(" ", 5432, "imdb", "repl", "", 100, 10_000));
    assertThrows(IllegalArgumentException.class,
        () -> new PgConnectionSettings("db", 0, "imdb", "repl", "", 100, 10_000));
    assertThrows(IllegalArgumentException.class,
        () -> new PgConnectionSettings("db", 5432, "imdb", "repl", "", 0, 10_000));
  }
}
