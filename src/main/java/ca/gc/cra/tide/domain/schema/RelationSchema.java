package ca.gc.cra.tide.domain.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Latest known shape of a relation: names, replica identity, and ordered columns.
 * <p><strong>Why:</strong> Row-change messages carry positional tuples only; this schema names and types them.</p>
 * <p><strong>Role:</strong> Domain value owned by the relation cache, replaced whole when the server re-announces it.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param relationId server-assigned relation id
 * @param namespace schema name (e.g., {@code public}); never {@code null}
 * @param name table name; never {@code null}
 * @param replicaIdentity replica identity setting; never {@code null}
 * @param columns columns in wire order; copied
 * @since 0.1.0
 */
public record RelationSchema(
    int relationId,
    String namespace,
    String name,
    ReplicaIdentity replicaIdentity,
    List<ColumnDescriptor> columns) {

  /**
   * Validates constructor invariants and copies the column list.
   */
  public RelationSchema {
    namespace = Objects.requireNonNull(namespace, "namespace");
    name = Objects.requireNonNull(name, "name");
    replicaIdentity = Objects.requireNonNull(replicaIdentity, "replicaIdentity");
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  /**
   * Returns the number of columns.
   *
   * @return column count
   */
  public int columnCount() {
    return columns.size();
  }

  /**
   * Returns the names of columns flagged as part of the replica identity key, in column order.
   *
   * @return key column names; empty when the relation has no key
   */
  public List<String> keyColumnNames() {
    List<String> keys = new ArrayList<>();
    for (ColumnDescriptor column : columns) {
      if (column.key()) {
        keys.add(column.name());
      }
    }
    return List.copyOf(keys);
  }

  /**
   * Returns the {@code schema.table} name.
   *
   * @return qualified relation name
   */
  public String qualifiedName() {
    return namespace + '.' + name;
  }
}
