package ca.gc.cra.tide.infrastructure.replication;

import ca.gc.cra.tide.logging.Logs;
import ca.gc.cra.tide.validation.Numbers;
import ca.gc.cra.tide.validation.Strings;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Connection parameters for a PostgreSQL replication session.
 *
 * @param host server host name
 * @param port server port
 * @param database database holding the publication
 * @param user role with the {@code REPLICATION} attribute
 * @param password password; may be {@code null} for trust or peer authentication
 * @param pollIntervalMillis pause between polls when no message is pending
 * @param statusIntervalMillis interval of the driver's automatic standby status updates
 * @since 0.1.0
 */
public record PgConnectionSettings(
    String host,
    int port,
    String database,
    String user,
    String password,
    long pollIntervalMillis,
    int statusIntervalMillis) {

  /**
   * Validates constructor invariants.
   */
  public PgConnectionSettings {
    host = Strings.requireNonBlank("host", host);
    Numbers.requireRange("port", port, 1, 65_535);
    database = Strings.requireNonBlank("database", database);
    user = Strings.requireNonBlank("user", user);
    Numbers.requireRange("pollIntervalMillis", pollIntervalMillis, 1, 60_000);
    Numbers.requireRange("statusIntervalMillis", statusIntervalMillis, 100, 3_600_000);
  }

  /**
   * Returns the JDBC URL of the database.
   *
   * @return URL such as {@code jdbc:postgresql://localhost:5432/app}
   */
  public String jdbcUrl() {
    String hostPart = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
    return "jdbc:postgresql://" + hostPart + ":" + port + "/" + database;
  }

  /**
   * Returns driver properties for a logical replication connection.
   *
   * @return new properties instance
   */
  public Properties replicationProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, user);
    if (password != null && !password.isEmpty()) {
      PGProperty.PASSWORD.set(props, password);
    }
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    PGProperty.APPLICATION_NAME.set(props, "tide");
    return props;
  }

  @Override
  public String toString() {
    return "PgConnectionSettings{" + user + "@" + host + ":" + port + "/" + database
        + ", password=" + Logs.redact(password)
        + ", pollIntervalMillis=" + pollIntervalMillis
        + ", statusIntervalMillis=" + statusIntervalMillis + '}';
  }
}
