/**
 * <strong>Purpose:</strong> Replication stream loop and the subscriber-facing consumer facade.
 * <p><strong>Pipeline role:</strong> receive -> decode -> route -> build -> dispatch -> acknowledge.
 * <p><strong>Concurrency:</strong> One runner per stream; runners share no mutable state.
 * <p><strong>Observability:</strong> Emits {@code stream.*} metrics and lifecycle logs per slot.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.pipeline;
