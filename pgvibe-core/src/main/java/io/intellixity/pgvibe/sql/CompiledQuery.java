package io.intellixity.pgvibe.sql;

import java.util.*;

/**
 * SQL text with {@code $1..$n} placeholders; {@code parameters.get(i)} is the value for {@code $(i+1)}.
 * Parameters may contain nulls.
 */
public record CompiledQuery(String sql, List<Object> parameters) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
  }
}
