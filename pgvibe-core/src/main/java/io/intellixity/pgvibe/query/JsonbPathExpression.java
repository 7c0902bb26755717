package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.List;

/** Path navigation rendered with {@code #>} / {@code #>>}. */
public final class JsonbPathExpression {
  private final ColumnRef column;
  private final List<String> path;

  JsonbPathExpression(ColumnRef column, List<String> path) {
    this.column = column;
    this.path = List.copyOf(path);
  }

  public List<String> path() { return path; }

  public JsonCondition isEqualTo(Object value) {
    if (value == null) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "jsonb path " + path + " on '" + column + "': use isNull() instead of isEqualTo(null)");
    }
    return new JsonCondition(column, JsonOperator.FIELD_EQUALS, path, PathStyle.PATH, value);
  }

  public JsonCondition exists() {
    return new JsonCondition(column, JsonOperator.FIELD_EXISTS, path, PathStyle.PATH, null);
  }

  public JsonCondition isNull() {
    return new JsonCondition(column, JsonOperator.FIELD_IS_NULL, path, PathStyle.PATH, null);
  }
}
