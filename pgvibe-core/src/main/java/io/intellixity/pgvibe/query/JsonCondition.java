package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;

import java.util.List;
import java.util.Objects;

/**
 * Predicate on a jsonb column. {@code path} is the navigated key sequence for the FIELD_* operators and empty otherwise.
 * Operand shape is checked by {@link io.intellixity.pgvibe.query.JsonbExpressionBuilder}.
 */
public final class JsonCondition implements Expression {
  private final ColumnRef column;
  private final JsonOperator operator;
  private final List<String> path;
  private final PathStyle pathStyle;
  private final Object operand;

  public JsonCondition(ColumnRef column, JsonOperator operator, List<String> path, PathStyle pathStyle, Object operand) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.path = List.copyOf(path == null ? List.of() : path);
    this.pathStyle = pathStyle == null ? PathStyle.FIELD : pathStyle;
    this.operand = operand;
  }

  public ColumnRef column() { return column; }
  public JsonOperator operator() { return operator; }
  public List<String> path() { return path; }
  public PathStyle pathStyle() { return pathStyle; }
  public Object operand() { return operand; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
