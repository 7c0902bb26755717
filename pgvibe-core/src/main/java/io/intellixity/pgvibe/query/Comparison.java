package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/**
 * {@code column OP value}. The value is a bind value, or a {@link ColumnRef} for column-to-column comparisons.
 * For {@code IN}/{@code NOT IN} the value is a list (arrays are copied into one).
 */
public final class Comparison implements Expression {
  private final ColumnRef column;
  private final ComparisonOperator operator;
  private final Object value;

  public Comparison(ColumnRef column, ComparisonOperator operator, Object value) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = checkOperand(column, operator, value);
  }

  public ColumnRef column() { return column; }
  public ComparisonOperator operator() { return operator; }
  public Object value() { return value; }

  public boolean comparesColumns() { return value instanceof ColumnRef; }

  @SuppressWarnings("unchecked")
  public List<Object> values() {
    return operator.isCollectionOperator() ? (List<Object>) value : List.of();
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  private static Object checkOperand(ColumnRef column, ComparisonOperator op, Object value) {
    if (op.isCollectionOperator()) {
      List<Object> list = Operands.asList(value);
      if (list == null) {
        throw new QueryValidationException(Kind.INVALID_OPERAND,
            "Operator " + op.sql() + " on '" + column + "' requires a collection or array, got " + Operands.describe(value));
      }
      return Collections.unmodifiableList(list);
    }
    if (op.isNullOperator()) {
      if (value != null) {
        throw new QueryValidationException(Kind.INVALID_OPERAND,
            "Operator " + op.sql() + " on '" + column + "' only accepts null, got " + Operands.describe(value));
      }
      return null;
    }
    if (value == null && op != ComparisonOperator.EQ && op != ComparisonOperator.NE) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "Operator " + op.sql() + " on '" + column + "' does not accept null");
    }
    if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "Operator " + op.sql() + " on '" + column + "' requires a scalar, got " + Operands.describe(value));
    }
    return value;
  }
}
