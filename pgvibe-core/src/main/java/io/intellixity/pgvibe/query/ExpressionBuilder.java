package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.scope.Scope;

import java.util.*;

/**
 * Factory for predicate nodes, bound to the scope of the query being built.
 *
 * <p>Column references are parsed and resolved when the node is built, so a bad reference fails inside
 * the {@code where} callback rather than at compile time.</p>
 */
public final class ExpressionBuilder {
  private final Scope scope;

  public ExpressionBuilder(Scope scope) {
    this.scope = Objects.requireNonNull(scope, "scope");
  }

  public Scope scope() { return scope; }

  /** Column operand for column-to-column comparisons: {@code cmp("u.id", "=", ref("p.user_id"))}. */
  public ColumnRef ref(String column) { return scope.resolveColumn(column, null); }

  public Comparison cmp(String column, String operator, Object value) {
    return cmp(column, ComparisonOperator.parse(operator), value);
  }

  public Comparison cmp(String column, ComparisonOperator operator, Object value) {
    return new Comparison(ref(column), operator, value);
  }

  public Comparison eq(String column, Object value) { return cmp(column, ComparisonOperator.EQ, value); }
  public Comparison ne(String column, Object value) { return cmp(column, ComparisonOperator.NE, value); }
  public Comparison lt(String column, Object value) { return cmp(column, ComparisonOperator.LT, value); }
  public Comparison le(String column, Object value) { return cmp(column, ComparisonOperator.LE, value); }
  public Comparison gt(String column, Object value) { return cmp(column, ComparisonOperator.GT, value); }
  public Comparison ge(String column, Object value) { return cmp(column, ComparisonOperator.GE, value); }
  public Comparison like(String column, String pattern) { return cmp(column, ComparisonOperator.LIKE, pattern); }
  public Comparison ilike(String column, String pattern) { return cmp(column, ComparisonOperator.ILIKE, pattern); }
  public Comparison in(String column, Collection<?> values) { return cmp(column, ComparisonOperator.IN, values); }
  public Comparison notIn(String column, Collection<?> values) { return cmp(column, ComparisonOperator.NOT_IN, values); }
  public Comparison isNull(String column) { return cmp(column, ComparisonOperator.IS, null); }
  public Comparison isNotNull(String column) { return cmp(column, ComparisonOperator.IS_NOT, null); }

  /** {@code and()} with no arguments renders {@code true}. */
  public LogicalGroup and(Expression... elements) { return and(Arrays.asList(elements)); }
  public LogicalGroup and(List<? extends Expression> elements) { return LogicalGroup.and(checked(elements)); }

  /** {@code or()} with no arguments renders {@code false}. */
  public LogicalGroup or(Expression... elements) { return or(Arrays.asList(elements)); }
  public LogicalGroup or(List<? extends Expression> elements) { return LogicalGroup.or(checked(elements)); }

  public NotElement not(Expression element) {
    if (element == null) {
      throw new QueryValidationException(QueryValidationException.Kind.INVALID_OPERAND, "not() requires an expression");
    }
    return new NotElement(element);
  }

  public RawFragment raw(String sql, Object... params) { return RawFragment.of(sql, params); }

  public ArrayExpressionBuilder array(String column) {
    ColumnRef ref = ref(column);
    return new ArrayExpressionBuilder(ref, elementType(ref));
  }

  public JsonbExpressionBuilder jsonb(String column) {
    return new JsonbExpressionBuilder(ref(column));
  }

  private String elementType(ColumnRef ref) {
    return scope.columnType(ref)
        .filter(t -> t.endsWith("[]"))
        .map(t -> t.substring(0, t.length() - 2).trim())
        .orElse("text");
  }

  private static List<? extends Expression> checked(List<? extends Expression> elements) {
    if (elements == null) return List.of();
    for (Expression e : elements) {
      if (e == null) {
        throw new QueryValidationException(QueryValidationException.Kind.INVALID_OPERAND,
            "Logical groups cannot contain null expressions");
      }
    }
    return elements;
  }
}
