/**
 * Replication stream positions, frames, and transaction context.
 * <p><strong>Role:</strong> Domain values shared by the replication source port and the stream runner.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.tide.domain.replication;
