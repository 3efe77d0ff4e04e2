package ca.gc.cra.tide.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {
  @Test
  void blankValuesFallBackToDefaults() {
    TelemetrySettings settings = new TelemetrySettings(" ", null, null, null);

    assertEquals("otlp", settings.exporter());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertEquals("", settings.resourceAttributes());
    assertEquals(Duration.ofSeconds(30), settings.exportInterval());
    assertFalse(settings.disabled());
  }

  @Test
  void exporterNoneDisablesExport() {
    assertTrue(new TelemetrySettings(" None ", null, null, null).disabled());
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () -> new TelemetrySettings("otlp", null, null, Duration.ZERO));
  }
}
