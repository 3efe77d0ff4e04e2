/**
 * Per-stream cache of relation schemas announced by the replication stream.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.schema;
