package ca.gc.cra.tide.domain.schema;

import java.util.Objects;

/**
 * Column metadata as announced by a Relation message.
 *
 * @param name column name; never {@code null}
 * @param typeOid PostgreSQL type OID used to pick a value coercion
 * @param typeModifier type modifier ({@code atttypmod}); {@code -1} when absent
 * @param key whether the column is part of the relation's replica identity key
 * @since 0.1.0
 */
public record ColumnDescriptor(String name, int typeOid, int typeModifier, boolean key) {
  /**
   * Validates constructor invariants.
   */
  public ColumnDescriptor {
    name = Objects.requireNonNull(name, "name");
  }
}
