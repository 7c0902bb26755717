package io.intellixity.pgvibe.query;

import java.util.*;

public final class LogicalGroup implements Expression {
  private final Clause clause;
  private final List<Expression> elements;

  public LogicalGroup(Clause clause, List<? extends Expression> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public static LogicalGroup and(List<? extends Expression> elements) { return new LogicalGroup(Clause.AND, elements); }
  public static LogicalGroup or(List<? extends Expression> elements) { return new LogicalGroup(Clause.OR, elements); }

  public Clause clause() { return clause; }
  public List<Expression> elements() { return elements; }
  public boolean isEmpty() { return elements.isEmpty(); }

  /** New group with {@code next} appended; this group is left untouched. */
  public LogicalGroup with(Expression next) {
    List<Expression> els = new ArrayList<>(elements.size() + 1);
    els.addAll(elements);
    els.add(Objects.requireNonNull(next, "next"));
    return new LogicalGroup(clause, els);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
