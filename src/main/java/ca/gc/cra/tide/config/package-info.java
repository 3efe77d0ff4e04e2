/**
 * Stream configuration and composition root wiring for the TIDE CLI.
 * <p><strong>Role:</strong> Bootstrap layer turning defaults, YAML, environment variables and {@code key=value}
 * arguments into a validated {@link ca.gc.cra.tide.config.StreamConfig} and a runnable
 * {@link ca.gc.cra.tide.application.pipeline.ReplicationConsumer}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Passwords are redacted from {@code toString()} and dry-run output.</p>
 */
package ca.gc.cra.tide.config;
