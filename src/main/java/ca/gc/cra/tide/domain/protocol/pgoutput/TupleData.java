package ca.gc.cra.tide.domain.protocol.pgoutput;

import java.util.List;

/**
 * Positional column values of one row image.
 *
 * @param fields values in column order; copied
 * @since 0.1.0
 */
public record TupleData(List<TupleField> fields) {
  /**
   * Copies the field list.
   */
  public TupleData {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  /**
   * Returns the number of columns in the image.
   *
   * @return column count
   */
  public int size() {
    return fields.size();
  }

  /**
   * Returns the value at a column position.
   *
   * @param index zero-based column position
   * @return field at {@code index}
   */
  public TupleField get(int index) {
    return fields.get(index);
  }
}
