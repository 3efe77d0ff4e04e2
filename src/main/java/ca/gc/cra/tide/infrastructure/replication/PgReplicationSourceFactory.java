package ca.gc.cra.tide.infrastructure.replication;

import ca.gc.cra.tide.application.port.ReplicationSource;
import ca.gc.cra.tide.application.port.ReplicationSourceFactory;
import ca.gc.cra.tide.domain.replication.Lsn;
import java.util.Objects;

/**
 * Opens {@link PgReplicationSource}s sharing one set of connection settings.
 *
 * @since 0.1.0
 */
public final class PgReplicationSourceFactory implements ReplicationSourceFactory {
  private final PgConnectionSettings settings;
  private final Lsn startPosition;

  /**
   * Creates a factory.
   *
   * @param settings connection settings; must not be {@code null}
   * @param startPosition resume position, or {@link Lsn#INVALID} to use the slot's confirmed position
   */
  public PgReplicationSourceFactory(PgConnectionSettings settings, Lsn startPosition) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.startPosition = startPosition == null ? Lsn.INVALID : startPosition;
  }

  @Override
  public ReplicationSource open(String slotName, String publicationName) {
    return new PgReplicationSource(settings, slotName, publicationName, startPosition);
  }
}
