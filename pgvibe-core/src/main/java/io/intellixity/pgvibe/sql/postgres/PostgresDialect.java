package io.intellixity.pgvibe.sql.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgvibe.dmlast.OnConflict;
import io.intellixity.pgvibe.query.ArrayCondition;
import io.intellixity.pgvibe.query.JsonCondition;
import io.intellixity.pgvibe.query.PathStyle;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.sql.AbstractSqlDialect;

import java.util.*;

/**
 * PostgreSQL dialect.
 *
 * Adds array operators, jsonb operators, {@code ON CONFLICT} and {@code RETURNING}.
 * Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Override public String id() { return "postgres"; }

  @Override
  protected String renderArray(ArrayCondition c, String column, RenderCtx ctx) {
    switch (c.operator()) {
      case CONTAINS:
        return column + " @> " + arrayLiteral(c, ctx);
      case CONTAINED_BY:
        return column + " <@ " + arrayLiteral(c, ctx);
      case OVERLAPS:
        return column + " && " + arrayLiteral(c, ctx);
      case HAS_ANY:
        return ctx.add(c.operand()) + " = ANY(" + column + ")";
      case HAS_ALL:
        return ctx.add(c.operand()) + " = ALL(" + column + ")";
      default:
        throw new IllegalArgumentException("Unknown array operator: " + c.operator());
    }
  }

  /** {@code ARRAY[$1, $2]}, or a typed empty literal so the backend can infer the element type. */
  private static String arrayLiteral(ArrayCondition c, RenderCtx ctx) {
    List<Object> vals = c.values();
    if (vals.isEmpty()) return "ARRAY[]::" + c.elementType() + "[]";
    List<String> ph = new ArrayList<>(vals.size());
    for (Object v : vals) ph.add(ctx.add(v));
    return "ARRAY[" + String.join(", ", ph) + "]";
  }

  @Override
  protected String renderJson(JsonCondition c, String column, RenderCtx ctx) {
    List<String> path = c.path();
    switch (c.operator()) {
      case CONTAINS:
        return column + " @> " + ctx.add(toJson(c)) + "::jsonb";
      case CONTAINED_BY:
        return column + " <@ " + ctx.add(toJson(c)) + "::jsonb";
      case HAS_KEY:
        return column + " ? " + ctx.add(c.operand());
      case HAS_ANY_KEY:
        return column + " ?| " + ctx.add(c.operand());
      case HAS_ALL_KEYS:
        return column + " ?& " + ctx.add(c.operand());
      case FIELD_EQUALS: {
        boolean scalar = isScalar(c.operand());
        String lhs = navigate(column, path, c.pathStyle(), scalar);
        return scalar
            ? lhs + " = " + ctx.add(String.valueOf(c.operand()))
            : lhs + " = " + ctx.add(toJson(c)) + "::jsonb";
      }
      case FIELD_EXISTS:
        if (c.pathStyle() == PathStyle.FIELD && path.size() == 1) {
          return column + " ? " + ctx.add(path.get(0));
        }
        return column + " #> " + textArrayLiteral(path) + " IS NOT NULL";
      case FIELD_IS_NULL:
        return navigate(column, path, c.pathStyle(), false) + " IS NULL";
      default:
        throw new IllegalArgumentException("Unknown document operator: " + c.operator());
    }
  }

  /** {@code col -> 'a' ->> 'b'} or {@code col #>> '{a,b}'}; {@code asText} selects the text-returning operator. */
  private static String navigate(String column, List<String> path, PathStyle style, boolean asText) {
    if (style == PathStyle.PATH) {
      return column + (asText ? " #>> " : " #> ") + textArrayLiteral(path);
    }
    StringBuilder sb = new StringBuilder(column);
    for (int i = 0; i < path.size(); i++) {
      boolean last = i == path.size() - 1;
      sb.append(last && asText ? " ->> " : " -> ").append(stringLiteral(path.get(i)));
    }
    return sb.toString();
  }

  /** {@code '{a,b}'}; elements with separators, quotes, braces or whitespace are double-quoted. */
  static String textArrayLiteral(List<String> keys) {
    List<String> parts = new ArrayList<>(keys.size());
    for (String k : keys) {
      boolean plain = !k.isEmpty() && !"null".equalsIgnoreCase(k);
      for (int i = 0; plain && i < k.length(); i++) {
        char ch = k.charAt(i);
        plain = !(ch == ',' || ch == '{' || ch == '}' || ch == '"' || ch == '\\' || Character.isWhitespace(ch));
      }
      parts.add(plain ? k : "\"" + k.replace("\\", "\\\\").replace("\"", "\\\"") + "\"");
    }
    return stringLiteral("{" + String.join(",", parts) + "}");
  }

  private static boolean isScalar(Object v) {
    return !(v instanceof Map<?, ?> || v instanceof Collection<?> || v.getClass().isArray()
        || v instanceof com.fasterxml.jackson.databind.JsonNode);
  }

  private static String toJson(JsonCondition c) {
    try {
      return JSON.writeValueAsString(c.operand());
    } catch (JsonProcessingException e) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "Cannot serialize jsonb operand for '" + c.column() + "': " + e.getOriginalMessage(), e);
    }
  }

  @Override
  protected String applyOnConflict(String insertSql, OnConflict oc, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder(insertSql).append(" ON CONFLICT");
    if (!oc.targetColumns().isEmpty()) {
      sql.append(" (").append(String.join(", ", oc.targetColumns().stream().map(this::quoteIdent).toList())).append(')');
    } else if (oc.constraint() != null) {
      sql.append(" ON CONSTRAINT ").append(quoteIdent(oc.constraint()));
    }
    if (oc.action() == OnConflict.Action.DO_NOTHING) {
      return sql.append(" DO NOTHING").toString();
    }
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Object> e : oc.updates().entrySet()) {
      sets.add(quoteIdent(e.getKey()) + " = " + ctx.add(e.getValue()));
    }
    return sql.append(" DO UPDATE SET ").append(String.join(", ", sets)).toString();
  }

  @Override
  protected String applyReturning(String insertSql, List<String> returning) {
    List<String> items = new ArrayList<>(returning.size());
    for (String c : returning) items.add("*".equals(c) ? c : quoteIdent(c));
    return insertSql + " RETURNING " + String.join(", ", items);
  }
}
