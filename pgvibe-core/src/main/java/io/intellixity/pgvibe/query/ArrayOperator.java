package io.intellixity.pgvibe.query;

public enum ArrayOperator {
  /** {@code col @> ARRAY[...]} */
  CONTAINS,
  /** {@code col <@ ARRAY[...]} */
  CONTAINED_BY,
  /** {@code col && ARRAY[...]} */
  OVERLAPS,
  /** {@code $n = ANY(col)} */
  HAS_ANY,
  /** {@code $n = ALL(col)} */
  HAS_ALL;

  public boolean takesList() { return this == CONTAINS || this == CONTAINED_BY || this == OVERLAPS; }
}
