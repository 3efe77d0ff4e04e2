/**
 * CLI entry points for streaming a replication slot and decoding single {@code pgoutput} messages.
 * <p><strong>Role:</strong> Driving-side adapter layer; parses arguments, configures logging and telemetry, and runs
 * the {@link ca.gc.cra.tide.application.pipeline.ReplicationConsumer}.</p>
 * <p><strong>Concurrency:</strong> Commands run on the invoking thread; a shutdown hook requests a cooperative stop.</p>
 * <p><strong>Security:</strong> Passwords never appear in dry-run output or logs.</p>
 */
package ca.gc.cra.tide.api;
