/**
 * Structured forms of {@code pgoutput} logical replication messages (protocol version 1).
 * <p><strong>Role:</strong> Domain outputs of the message decoder consumed by the stream runner.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; tuple bytes are copied on access.</p>
 * <p><strong>Security:</strong> Tuple data holds raw column values; avoid logging it unbounded.</p>
 */
package ca.gc.cra.tide.domain.protocol.pgoutput;
