package ca.gc.cra.tide.application.port;

/**
 * Opens replication sources for a slot and publication.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ReplicationSourceFactory {
  /**
   * Creates an unstarted source streaming {@code publicationName} changes from {@code slotName}.
   *
   * @param slotName existing logical replication slot
   * @param publicationName existing publication
   * @return new source; the caller starts and closes it
   * @throws Exception if the source cannot be created
   */
  ReplicationSource open(String slotName, String publicationName) throws Exception;
}
