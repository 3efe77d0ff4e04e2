/**
 * <strong>Purpose:</strong> Conversion of wire-format column values into Java values keyed by PostgreSQL type OID.
 * <p><strong>Concurrency:</strong> Coercers are stateless apart from the shared metrics port; thread-safe.
 * <p><strong>Observability:</strong> Failed conversions are logged and counted as {@code coerce.failure}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tide.application.coercion;
