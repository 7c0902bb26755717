package io.intellixity.pgvibe.dmlast;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.ident.TableRef;

import java.util.Objects;

/** {@code <type> JOIN table ON left = right}; both columns are already qualified. */
public record JoinClause(JoinType type, TableRef table, ColumnRef left, ColumnRef right) {
  public JoinClause {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }
}
