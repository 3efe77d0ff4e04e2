/**
 * Binary decoder for the {@code pgoutput} logical decoding plugin, protocol version 1.
 * <p><strong>Concurrency:</strong> The decoder is stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.infrastructure.protocol.pgoutput;
