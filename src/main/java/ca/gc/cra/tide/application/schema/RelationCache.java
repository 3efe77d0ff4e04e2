package ca.gc.cra.tide.application.schema;

import ca.gc.cra.tide.domain.schema.RelationSchema;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Holds the most recent {@link RelationSchema} for each relation id seen on a stream.
 * <p><strong>Why:</strong> Row-change messages reference relations by id only; names and column types come from
 * earlier Relation messages.</p>
 * <p><strong>Role:</strong> Application state owned by a single stream runner.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the stream runner thread.</p>
 * <p><strong>Performance:</strong> O(1) update and lookup.</p>
 * <p><strong>Observability:</strong> Logs schema replacements at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class RelationCache {
  private static final Logger log = LoggerFactory.getLogger(RelationCache.class);

  private final Map<Integer, RelationSchema> schemas = new HashMap<>();

  /**
   * Stores a schema, replacing any earlier schema for the same relation id.
   *
   * @param schema announced schema; never {@code null}
   */
  public void update(RelationSchema schema) {
    Objects.requireNonNull(schema, "schema");
    RelationSchema previous = schemas.put(schema.relationId(), schema);
    if (previous == null) {
      log.debug("Cached relation {} as {} with {} columns",
          Integer.toUnsignedString(schema.relationId()), schema.qualifiedName(), schema.columnCount());
    } else if (!previous.equals(schema)) {
      log.debug("Replaced relation {} schema {} -> {} ({} -> {} columns)",
          Integer.toUnsignedString(schema.relationId()), previous.qualifiedName(), schema.qualifiedName(),
          previous.columnCount(), schema.columnCount());
    }
  }

  /**
   * Returns the current schema for a relation id.
   *
   * @param relationId relation id from a change message
   * @return latest schema
   * @throws UnknownRelationException when no schema has been cached for {@code relationId}
   */
  public RelationSchema resolve(int relationId) {
    RelationSchema schema = schemas.get(relationId);
    if (schema == null) {
      throw new UnknownRelationException(relationId);
    }
    return schema;
  }

  /**
   * Looks up a schema without failing.
   *
   * @param relationId relation id
   * @return cached schema, if any
   */
  public Optional<RelationSchema> find(int relationId) {
    return Optional.ofNullable(schemas.get(relationId));
  }

  /**
   * Returns the number of cached relations.
   *
   * @return cached relation count
   */
  public int size() {
    return schemas.size();
  }

  /**
   * Forgets every cached schema; the server re-announces relations on a new session.
   */
  public void clear() {
    schemas.clear();
  }
}
