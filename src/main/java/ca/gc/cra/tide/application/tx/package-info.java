/**
 * Transaction boundary tracking for a replication stream.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.tx;
