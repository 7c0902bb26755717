package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;

import java.util.Arrays;
import java.util.Collection;

/** Predicates on one array column; obtained from {@link ExpressionBuilder#array(String)}. */
public final class ArrayExpressionBuilder {
  private final ColumnRef column;
  private final String elementType;

  ArrayExpressionBuilder(ColumnRef column, String elementType) {
    this.column = column;
    this.elementType = elementType;
  }

  public ColumnRef column() { return column; }
  public String elementType() { return elementType; }

  /** Column holds every given value. An empty list matches every row. */
  public ArrayCondition contains(Collection<?> values) { return list(ArrayOperator.CONTAINS, values); }
  public ArrayCondition contains(Object... values) { return contains(Arrays.asList(values)); }

  public ArrayCondition isContainedBy(Collection<?> values) { return list(ArrayOperator.CONTAINED_BY, values); }
  public ArrayCondition isContainedBy(Object... values) { return isContainedBy(Arrays.asList(values)); }

  /** Column shares at least one element with the given values. An empty list matches no row. */
  public ArrayCondition overlaps(Collection<?> values) { return list(ArrayOperator.OVERLAPS, values); }
  public ArrayCondition overlaps(Object... values) { return overlaps(Arrays.asList(values)); }

  public ArrayCondition hasAny(Object value) { return new ArrayCondition(column, ArrayOperator.HAS_ANY, value, elementType); }
  public ArrayCondition hasAll(Object value) { return new ArrayCondition(column, ArrayOperator.HAS_ALL, value, elementType); }

  private ArrayCondition list(ArrayOperator op, Collection<?> values) {
    return new ArrayCondition(column, op, values, elementType);
  }
}
