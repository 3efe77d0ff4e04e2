package ca.gc.cra.tide.domain.protocol.pgoutput;

/**
 * One relation named by a Truncate message.
 *
 * @param relationId truncated relation
 * @param cascade whether {@code CASCADE} was requested
 * @param restartIdentity whether {@code RESTART IDENTITY} was requested
 * @since 0.1.0
 */
public record TruncatedRelation(int relationId, boolean cascade, boolean restartIdentity) implements RawChange {}
