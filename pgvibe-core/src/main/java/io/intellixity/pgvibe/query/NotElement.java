package io.intellixity.pgvibe.query;

import java.util.Objects;

/** Unary NOT for a predicate subtree. */
public final class NotElement implements Expression {
  private final Expression element;

  public NotElement(Expression element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public Expression element() { return element; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
