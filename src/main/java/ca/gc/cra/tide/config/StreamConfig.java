package ca.gc.cra.tide.config;

import ca.gc.cra.tide.application.pipeline.AcknowledgementPolicy;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.infrastructure.replication.PgConnectionSettings;
import ca.gc.cra.tide.validation.Numbers;
import ca.gc.cra.tide.validation.Strings;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for one {@code stream} run.
 * <p><strong>Why:</strong> Gathers connection, slot, acknowledgment and subscription settings in one immutable value
 * so the composition root never reads raw strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param connection database connection settings
 * @param slotName logical replication slot
 * @param publicationName publication to stream
 * @param startLsn resume position; {@link Lsn#INVALID} resumes from the slot's confirmed position
 * @param acknowledgement acknowledgment cadence
 * @param subscriptions logging subscriptions registered by the CLI
 * @param logValueBytes byte budget for each logged column value
 * @since 0.1.0
 */
public record StreamConfig(
    PgConnectionSettings connection,
    String slotName,
    String publicationName,
    Lsn startLsn,
    AcknowledgementPolicy acknowledgement,
    List<SubscriptionSpec> subscriptions,
    int logValueBytes) {

  /**
   * Validates constructor invariants.
   */
  public StreamConfig {
    Objects.requireNonNull(connection, "connection");
    slotName = Strings.requireIdentifier("slotName", slotName);
    publicationName = Strings.requireIdentifier("publicationName", publicationName);
    startLsn = Objects.requireNonNullElse(startLsn, Lsn.INVALID);
    Objects.requireNonNull(acknowledgement, "acknowledgement");
    subscriptions = List.copyOf(Objects.requireNonNull(subscriptions, "subscriptions"));
    Numbers.requireRange("logValueBytes", logValueBytes, 16, 1 << 20);
  }

  /**
   * Builds a configuration from flattened key/value pairs, falling back to {@link StreamDefaults} per key.
   *
   * @param values effective configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if any value is missing, malformed, or out of range
   */
  public static StreamConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    PgConnectionSettings connection = new PgConnectionSettings(
        value(values, "host"),
        (int) Numbers.parseRange("port", value(values, "port"), 1, 65_535),
        value(values, "database"),
        value(values, "user"),
        value(values, "password"),
        Numbers.parseRange("pollIntervalMillis", value(values, "pollIntervalMillis"), 1, 60_000),
        (int) Numbers.parseRange("statusIntervalMillis", value(values, "statusIntervalMillis"), 100, 3_600_000));

    String rawLsn = value(values, "startLsn");
    Lsn startLsn = rawLsn.isBlank() ? Lsn.INVALID : Lsn.parse(rawLsn.trim());

    AcknowledgementPolicy acknowledgement = new AcknowledgementPolicy(
        (int) Numbers.parseRange("ackMessages", value(values, "ackMessages"), 1, 1_000_000),
        Numbers.parseRange("ackIntervalMillis", value(values, "ackIntervalMillis"), 0, 3_600_000));

    return new StreamConfig(
        connection,
        value(values, "slotName"),
        value(values, "publicationName"),
        startLsn,
        acknowledgement,
        SubscriptionSpec.parseList(value(values, "subscriptions")),
        (int) Numbers.parseRange("logValueBytes", value(values, "logValueBytes"), 16, 1 << 20));
  }

  private static String value(Map<String, String> values, String key) {
    String raw = values.get(key);
    if (raw == null) {
      raw = StreamDefaults.asFlatMap().get(key);
    }
    return raw == null ? "" : raw;
  }
}
