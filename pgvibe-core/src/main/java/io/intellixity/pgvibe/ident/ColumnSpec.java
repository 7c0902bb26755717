package io.intellixity.pgvibe.ident;

import java.util.Objects;

/** Parsed select-list item: {@code [qualifier.]column [AS alias]}, where column may be {@code *}. */
public record ColumnSpec(String qualifier, String column, String alias) {
  public static final String WILDCARD = "*";

  public ColumnSpec {
    Objects.requireNonNull(column, "column");
  }

  public boolean isWildcard() { return WILDCARD.equals(column); }

  public ColumnRef ref() { return new ColumnRef(qualifier, column); }

  /** Name as written, without the alias. */
  public String name() { return qualifier == null ? column : qualifier + "." + column; }
}
