package io.intellixity.pgvibe.query;

public enum JsonOperator {
  CONTAINS,
  CONTAINED_BY,
  HAS_KEY,
  HAS_ANY_KEY,
  HAS_ALL_KEYS,
  FIELD_EQUALS,
  FIELD_EXISTS,
  FIELD_IS_NULL;

  public boolean navigates() { return this == FIELD_EQUALS || this == FIELD_EXISTS || this == FIELD_IS_NULL; }
}
