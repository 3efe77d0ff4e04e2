/**
 * Typed change events delivered to subscribers.
 * <p><strong>Role:</strong> Domain outputs of the event builder flowing into the dispatcher and handler adapters.</p>
 * <p><strong>Concurrency:</strong> Events are immutable; safe to hand to other threads.</p>
 * <p><strong>Security:</strong> Events carry row values; handlers must treat them as sensitive data.</p>
 */
package ca.gc.cra.tide.domain.events;
