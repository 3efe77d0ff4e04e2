/**
 * <strong>Purpose:</strong> Subscription matching and fan-out of change events to handlers.
 * <p><strong>Concurrency:</strong> The registry is append-only until frozen; dispatch runs on the stream runner thread.
 * <p><strong>Observability:</strong> Emits {@code dispatch.handler.*} metrics and MDC keys {@code txId} and
 * {@code relation}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.dispatch;
