package io.intellixity.pgvibe.dmlast;

import io.intellixity.pgvibe.ident.TableRef;

import java.util.*;

/**
 * Multi-row INSERT. Every row holds one value per entry of {@code columns}, in that order.
 * {@code returning} holds column names and {@code "*"} entries, rendered in order.
 */
public record InsertAst(
    TableRef table,
    List<String> columns,
    List<List<Object>> rows,
    OnConflict onConflict,
    List<String> returning
) {
  public InsertAst {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<Object>> rs = new ArrayList<>();
    if (rows != null) {
      for (List<Object> r : rows) rs.add(Collections.unmodifiableList(new ArrayList<>(r)));
    }
    rows = Collections.unmodifiableList(rs);
    returning = returning == null ? List.of() : List.copyOf(returning);
  }
}
