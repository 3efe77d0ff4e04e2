/**
 * Relation metadata announced by the replication stream.
 * <p><strong>Role:</strong> Domain values cached by the relation cache and used to name positional tuple data.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.tide.domain.schema;
