package io.intellixity.pgvibe.query;

/** How a JSON navigation was written: chained {@code .field(a).field(b)} or a single {@code .path(a, b)}. */
public enum PathStyle {
  FIELD,
  PATH
}
