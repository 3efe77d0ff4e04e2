package ca.gc.cra.tide.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Metrics export settings resolved before the OpenTelemetry SDK is built.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra {@code k=v,k2=v2} resource attributes; may be blank
 * @param exportInterval interval of the periodic metric reader
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  static final String DEFAULT_EXPORTER = "otlp";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  /**
   * Normalizes fields and applies defaults.
   */
  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank()
        ? DEFAULT_EXPORTER
        : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    exportInterval = Objects.requireNonNullElse(exportInterval, DEFAULT_INTERVAL);
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Resolves settings from JVM system properties ({@code otel.*}), falling back to {@code OTEL_*} environment
   * variables.
   *
   * @return resolved settings
   */
  public static TelemetrySettings fromEnvironment() {
    Properties props = System.getProperties();
    return new TelemetrySettings(
        firstNonBlank(props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER")),
        firstNonBlank(props.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT")),
        firstNonBlank(props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES")),
        DEFAULT_INTERVAL);
  }

  /**
   * Indicates whether export is disabled.
   *
   * @return {@code true} when the exporter is {@code none}
   */
  public boolean disabled() {
    return "none".equals(exporter);
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second;
  }
}
