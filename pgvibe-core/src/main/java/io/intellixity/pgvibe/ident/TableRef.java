package io.intellixity.pgvibe.ident;

import java.util.Objects;

/** A table in FROM/JOIN position, optionally aliased. */
public record TableRef(String name, String alias) {
  public TableRef {
    Objects.requireNonNull(name, "name");
  }

  public static TableRef of(String name) { return new TableRef(name, null); }

  public boolean aliased() { return alias != null; }

  /** The only legal qualifier for this table's columns: the alias once assigned, else the name. */
  public String qualifier() { return alias != null ? alias : name; }
}
