/**
 * PgJDBC adapters opening PostgreSQL logical replication streams.
 * <p><strong>Concurrency:</strong> One source per stream runner; sources are not shared.</p>
 * <p><strong>Security:</strong> Connection passwords are never logged.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.infrastructure.replication;
