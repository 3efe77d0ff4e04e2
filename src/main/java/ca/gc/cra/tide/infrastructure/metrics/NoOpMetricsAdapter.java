package ca.gc.cra.tide.infrastructure.metrics;

import ca.gc.cra.tide.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Selected when {@code metricsExporter=none} so the stream runs without an SDK.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /**
   * Creates a discarding adapter.
   */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
