package ca.gc.cra.tide.application.dispatch;

import java.util.Objects;

/**
 * {@code schema.table} pattern in which either segment may be the wildcard {@code *}.
 *
 * @param schema schema literal or {@code *}
 * @param table table literal or {@code *}
 * @since 0.1.0
 */
public record TablePattern(String schema, String table) {
  /** Wildcard segment. */
  public static final String WILDCARD = "*";
  /** Pattern matching every relation. */
  public static final TablePattern ALL = new TablePattern(WILDCARD, WILDCARD);

  /**
   * Validates segments.
   */
  public TablePattern {
    schema = requireSegment("schema", schema);
    table = requireSegment("table", table);
  }

  /**
   * Parses {@code schema.table}; the first dot separates the segments.
   *
   * @param text pattern such as {@code public.*}
   * @return parsed pattern
   * @throws IllegalArgumentException when the text lacks a dot or has a blank segment
   */
  public static TablePattern parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("table pattern must not be null");
    }
    String trimmed = text.trim();
    int dot = trimmed.indexOf('.');
    if (dot < 0) {
      throw new IllegalArgumentException("table pattern must be schema.table (was '" + text + "')");
    }
    return new TablePattern(trimmed.substring(0, dot), trimmed.substring(dot + 1));
  }

  /**
   * Tests a relation name against this pattern.
   *
   * @param candidateSchema schema of the relation
   * @param candidateTable table of the relation
   * @return {@code true} when every segment is a wildcard or equal
   */
  public boolean matches(String candidateSchema, String candidateTable) {
    return segmentMatches(schema, candidateSchema) && segmentMatches(table, candidateTable);
  }

  @Override
  public String toString() {
    return schema + '.' + table;
  }

  private static boolean segmentMatches(String pattern, String candidate) {
    return WILDCARD.equals(pattern) || pattern.equals(candidate);
  }

  private static String requireSegment(String name, String value) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("table pattern " + name + " segment must not be blank");
    }
    return trimmed;
  }
}
