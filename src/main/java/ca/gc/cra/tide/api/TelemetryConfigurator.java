package ca.gc.cra.tide.api;

import ca.gc.cra.tide.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.tide.validation.Numbers;
import ca.gc.cra.tide.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@link TelemetrySettings} from the telemetry keys of the effective configuration.
 *
 * <p>Removes {@code metricsExporter}, {@code otelEndpoint}, {@code otelResourceAttributes} and
 * {@code otelExportIntervalSeconds} from the map; blank values fall back to the supplied settings, normally those
 * resolved from {@code otel.*} properties and {@code OTEL_*} variables.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings resolve(Map<String, String> values, TelemetrySettings fallback) {
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(fallback, "fallback");

    String exporter = fallback.exporter();
    String rawExporter = trimToNull(values.remove("metricsExporter"));
    if (rawExporter != null) {
      exporter = rawExporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    }

    String endpoint = fallback.endpoint();
    String rawEndpoint = trimToNull(values.remove("otelEndpoint"));
    if (rawEndpoint != null) {
      validateEndpoint(rawEndpoint);
      endpoint = rawEndpoint;
      log.debug("Configuring OTLP endpoint: {}", endpoint);
    }

    String resourceAttributes = fallback.resourceAttributes();
    String rawAttributes = trimToNull(values.remove("otelResourceAttributes"));
    if (rawAttributes != null) {
      resourceAttributes =
          Strings.requirePrintableAscii("otelResourceAttributes", rawAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    Duration interval = fallback.exportInterval();
    String rawInterval = trimToNull(values.remove("otelExportIntervalSeconds"));
    if (rawInterval != null) {
      interval = Duration.ofSeconds(Numbers.parseRange("otelExportIntervalSeconds", rawInterval, 1, 3_600));
    }
    return new TelemetrySettings(exporter, endpoint, resourceAttributes, interval);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
