/**
 * Core domain model for TIDE receive -> decode -> dispatch pipelines.
 * <p><strong>Role:</strong> Domain layer values describing log positions, protocol messages, relation schemas, and
 * change events without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code stream.*} and {@code dispatch.*} metrics.</p>
 * <p><strong>Security:</strong> Change events carry row data; downstream handlers require redaction and access controls.</p>
 */
package ca.gc.cra.tide.domain;
