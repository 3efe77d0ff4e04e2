package ca.gc.cra.tide.domain.protocol.pgoutput;

/**
 * Row-level change against a single relation, still in positional wire form.
 *
 * <p>Truncate messages naming several relations are split into one {@link TruncatedRelation} each before
 * they reach this form.</p>
 *
 * @since 0.1.0
 */
public sealed interface RawChange permits InsertMessage, UpdateMessage, DeleteMessage, TruncatedRelation {
  /**
   * Returns the relation the change applies to.
   *
   * @return relation id announced by a prior Relation message
   */
  int relationId();
}
