package io.intellixity.pgvibe.ident;

import java.util.Objects;

/** Column reference inside a predicate, ORDER BY or ON clause. {@code qualifier} is null for bare names. */
public record ColumnRef(String qualifier, String column) {
  public ColumnRef {
    Objects.requireNonNull(column, "column");
  }

  public static ColumnRef bare(String column) { return new ColumnRef(null, column); }

  public static ColumnRef qualified(String qualifier, String column) {
    return new ColumnRef(Objects.requireNonNull(qualifier, "qualifier"), column);
  }

  public boolean isQualified() { return qualifier != null; }

  public ColumnRef withQualifier(String q) { return new ColumnRef(q, column); }

  @Override
  public String toString() {
    return qualifier == null ? column : qualifier + "." + column;
  }
}
