package ca.gc.cra.tide.domain.events;

/**
 * Kind of row-level change carried by a {@link ChangeEvent}.
 *
 * @since 0.1.0
 */
public enum ChangeType {
  INSERT,
  UPDATE,
  DELETE,
  TRUNCATE
}
