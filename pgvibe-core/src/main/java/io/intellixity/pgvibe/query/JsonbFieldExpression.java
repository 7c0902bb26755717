package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.ArrayList;
import java.util.List;

/** Chained field navigation: {@code jsonb("meta").field("a").field("b")}. */
public final class JsonbFieldExpression {
  private final ColumnRef column;
  private final List<String> path;

  JsonbFieldExpression(ColumnRef column, List<String> path) {
    this.column = column;
    this.path = List.copyOf(path);
  }

  public List<String> path() { return path; }

  public JsonbFieldExpression field(String name) {
    List<String> next = new ArrayList<>(path);
    next.add(JsonbExpressionBuilder.checkKey(name));
    return new JsonbFieldExpression(column, next);
  }

  /** Scalars compare as text ({@code ->>}); maps and lists compare as jsonb. */
  public JsonCondition isEqualTo(Object value) {
    if (value == null) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "jsonb field " + path + " on '" + column + "': use isNull() instead of isEqualTo(null)");
    }
    return new JsonCondition(column, JsonOperator.FIELD_EQUALS, path, PathStyle.FIELD, value);
  }

  public JsonCondition exists() {
    return new JsonCondition(column, JsonOperator.FIELD_EXISTS, path, PathStyle.FIELD, null);
  }

  public JsonCondition isNull() {
    return new JsonCondition(column, JsonOperator.FIELD_IS_NULL, path, PathStyle.FIELD, null);
  }
}
