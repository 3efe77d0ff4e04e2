package ca.gc.cra.tide.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flattened defaults for the {@code stream} command; also the set of recognised configuration keys.
 */
public final class StreamDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private StreamDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable defaults in declaration order
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  /**
   * Returns every key the stream command understands.
   *
   * @return recognised keys
   */
  public static Set<String> knownKeys() {
    return DEFAULTS.keySet();
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", "localhost");
    map.put("port", "5432");
    map.put("database", "postgres");
    map.put("user", "postgres");
    map.put("password", "");
    map.put("slotName", "slot1");
    map.put("publicationName", "pub1");
    map.put("startLsn", "");
    map.put("ackMessages", "100");
    map.put("ackIntervalMillis", "10000");
    map.put("pollIntervalMillis", "100");
    map.put("statusIntervalMillis", "10000");
    map.put("subscriptions", "UPDATE:public.*");
    map.put("logValueBytes", "256");
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("otelExportIntervalSeconds", "");
    return Collections.unmodifiableMap(map);
  }
}
