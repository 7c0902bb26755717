package io.intellixity.pgvibe.dmlast;

import io.intellixity.pgvibe.ident.ColumnSpec;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Clause state of one SELECT. {@code where}, {@code limit} and {@code offset} are null when absent;
 * an empty selection list means {@code *}.
 */
public record SelectAst(
    TableRef from,
    boolean distinct,
    List<ColumnSpec> selections,
    List<JoinClause> joins,
    Expression where,
    List<OrderItem> orderBy,
    Long limit,
    Long offset
) {
  public SelectAst {
    Objects.requireNonNull(from, "from");
    selections = selections == null ? List.of() : List.copyOf(selections);
    joins = joins == null ? List.of() : List.copyOf(joins);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }
}
