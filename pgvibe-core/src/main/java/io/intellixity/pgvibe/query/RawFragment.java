package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/**
 * Verbatim SQL predicate with its own {@code $1..$k} placeholders, renumbered into the surrounding
 * statement at compile time.
 */
public final class RawFragment implements Expression {
  private final String sql;
  private final List<Object> params;

  private RawFragment(String sql, List<Object> params) {
    if (sql == null || sql.isBlank()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "Raw SQL fragment must not be empty");
    }
    this.sql = sql;
    this.params = Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static RawFragment of(String sql, Object... params) {
    return new RawFragment(sql, params == null ? List.of() : Arrays.asList(params));
  }

  public static RawFragment of(String sql, List<?> params) {
    return new RawFragment(sql, params == null ? List.of() : new ArrayList<>(params));
  }

  public String sql() { return sql; }
  public List<Object> params() { return params; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
