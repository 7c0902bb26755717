package io.intellixity.pgvibe.query;

/** Node of a WHERE predicate tree. The variant set is closed; compilers dispatch through {@link ExpressionVisitor}. */
public sealed interface Expression
    permits Comparison, LogicalGroup, NotElement, ArrayCondition, JsonCondition, RawFragment {
  <R> R accept(ExpressionVisitor<R> visitor);
}
