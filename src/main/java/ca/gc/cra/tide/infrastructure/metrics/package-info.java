/**
 * Metrics adapters: OpenTelemetry export and a no-op fallback.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe and may be shared by several stream runners.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.infrastructure.metrics;
