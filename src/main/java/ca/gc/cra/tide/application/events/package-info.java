/**
 * <strong>Purpose:</strong> Assembly of typed change events from positional row changes.
 * <p><strong>Concurrency:</strong> Builders are stateless; thread-safe when their coercer is.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.events;
