package io.intellixity.pgvibe.query;

public interface ExpressionVisitor<R> {
  R visit(Comparison comparison);
  R visit(LogicalGroup group);
  R visit(NotElement not);
  R visit(ArrayCondition array);
  R visit(JsonCondition json);
  R visit(RawFragment raw);
}
