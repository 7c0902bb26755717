package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/** Predicates on one jsonb column; obtained from {@link ExpressionBuilder#jsonb(String)}. */
public final class JsonbExpressionBuilder {
  private final ColumnRef column;

  JsonbExpressionBuilder(ColumnRef column) {
    this.column = column;
  }

  public ColumnRef column() { return column; }

  /** {@code col @> value::jsonb}; the value is serialized with Jackson when the query compiles. */
  public JsonCondition contains(Object value) { return document(JsonOperator.CONTAINS, value); }

  public JsonCondition containedBy(Object value) { return document(JsonOperator.CONTAINED_BY, value); }

  public JsonCondition hasKey(String key) {
    return new JsonCondition(column, JsonOperator.HAS_KEY, List.of(), PathStyle.FIELD, checkKey(key));
  }

  public JsonCondition hasAnyKey(String... keys) { return hasAnyKey(Arrays.asList(keys)); }
  public JsonCondition hasAnyKey(List<String> keys) { return keys(JsonOperator.HAS_ANY_KEY, keys); }

  public JsonCondition hasAllKeys(String... keys) { return hasAllKeys(Arrays.asList(keys)); }
  public JsonCondition hasAllKeys(List<String> keys) { return keys(JsonOperator.HAS_ALL_KEYS, keys); }

  public JsonbFieldExpression field(String name) {
    return new JsonbFieldExpression(column, List.of(checkKey(name)));
  }

  public JsonbPathExpression path(String... keys) { return path(Arrays.asList(keys)); }

  public JsonbPathExpression path(List<String> keys) {
    if (keys == null || keys.isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "jsonb path on '" + column + "' must have at least one key");
    }
    List<String> out = new ArrayList<>(keys.size());
    for (String k : keys) out.add(checkKey(k));
    return new JsonbPathExpression(column, out);
  }

  private JsonCondition document(JsonOperator op, Object value) {
    if (value == null) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "jsonb " + op + " on '" + column + "' requires a value");
    }
    return new JsonCondition(column, op, List.of(), PathStyle.FIELD, value);
  }

  private JsonCondition keys(JsonOperator op, List<String> keys) {
    if (keys == null || keys.isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "jsonb " + op + " on '" + column + "' requires at least one key");
    }
    List<String> out = new ArrayList<>(keys.size());
    for (String k : keys) out.add(checkKey(k));
    return new JsonCondition(column, op, List.of(), PathStyle.FIELD, List.copyOf(out));
  }

  static String checkKey(String key) {
    if (key == null || key.isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "jsonb key must be a non-empty string");
    }
    return key;
  }
}
