/**
 * <strong>Purpose:</strong> Ports separating the replication engine from transports, decoders, and subscribers.
 * <p><strong>Pipeline role:</strong> Application-layer contracts implemented by infrastructure adapters.
 * <p><strong>Concurrency:</strong> Each port documents its own threading expectations.
 * <p><strong>Observability:</strong> {@link ca.gc.cra.tide.application.port.MetricsPort} defines the metric contract.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.port;
