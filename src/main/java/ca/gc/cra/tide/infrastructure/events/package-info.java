/**
 * Change event handler adapters: structured logging and in-memory capture.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.infrastructure.events;
