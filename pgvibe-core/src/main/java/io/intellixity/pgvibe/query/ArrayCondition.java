package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Predicate on an array column. List operators carry a list operand; {@code HAS_ANY}/{@code HAS_ALL} a single element.
 * {@code elementType} is the declared element type used to cast an empty array literal.
 */
public final class ArrayCondition implements Expression {
  private final ColumnRef column;
  private final ArrayOperator operator;
  private final Object operand;
  private final String elementType;

  public ArrayCondition(ColumnRef column, ArrayOperator operator, Object operand, String elementType) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.elementType = elementType == null ? "text" : elementType;
    if (operator.takesList()) {
      List<Object> list = Operands.asList(operand);
      if (list == null) {
        throw new QueryValidationException(Kind.INVALID_OPERAND,
            "Array operator " + operator + " on '" + column + "' requires a collection or array, got " + Operands.describe(operand));
      }
      this.operand = Collections.unmodifiableList(list);
    } else {
      if (operand == null || operand instanceof java.util.Collection<?> || operand.getClass().isArray()) {
        throw new QueryValidationException(Kind.INVALID_OPERAND,
            "Array operator " + operator + " on '" + column + "' requires a single non-null element, got " + Operands.describe(operand));
      }
      this.operand = operand;
    }
  }

  public ColumnRef column() { return column; }
  public ArrayOperator operator() { return operator; }
  public Object operand() { return operand; }
  public String elementType() { return elementType; }

  @SuppressWarnings("unchecked")
  public List<Object> values() { return operator.takesList() ? (List<Object>) operand : List.of(operand); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
