package io.intellixity.pgvibe.sql;

import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.query.RawFragment;

import java.util.*;
import java.util.function.Function;

/**
 * Rewrites the local {@code $1..$k} placeholders of a raw fragment into the surrounding statement's numbering.
 *
 * <p>Placeholders inside single-quoted literals, double-quoted identifiers, line comments and block comments are left alone.
 * Numbers are assigned in order of first appearance; a repeated {@code $k} reuses its number.</p>
 */
final class RawSqlRenumberer {
  private RawSqlRenumberer() {}

  /**
   * @param bind registers a parameter in the surrounding statement and returns its placeholder
   */
  static String renumber(RawFragment raw, Function<Object, String> bind) {
    String sql = raw.sql();
    List<Object> params = raw.params();
    Map<Integer, String> assigned = new HashMap<>();
    StringBuilder out = new StringBuilder(sql.length() + 8);

    int i = 0;
    int n = sql.length();
    while (i < n) {
      char ch = sql.charAt(i);
      if (ch == '\'' || ch == '"') {
        int end = skipQuoted(sql, i, ch);
        out.append(sql, i, end);
        i = end;
        continue;
      }
      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = end < 0 ? n : end;
        out.append(sql, i, end);
        i = end;
        continue;
      }
      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = skipBlockComment(sql, i);
        out.append(sql, i, end);
        i = end;
        continue;
      }
      if (ch == '$' && i + 1 < n && Character.isDigit(sql.charAt(i + 1))) {
        int j = i + 1;
        while (j < n && Character.isDigit(sql.charAt(j))) j++;
        int k = parseIndex(sql.substring(i + 1, j), raw);
        if (k < 1 || k > params.size()) {
          throw new QueryValidationException(Kind.INVALID_OPERAND,
              "Raw SQL references $" + k + " but only " + params.size() + " parameter(s) were given: " + sql);
        }
        String ph = assigned.get(k);
        if (ph == null) {
          ph = bind.apply(params.get(k - 1));
          assigned.put(k, ph);
        }
        out.append(ph);
        i = j;
        continue;
      }
      out.append(ch);
      i++;
    }

    if (assigned.size() != params.size()) {
      for (int k = 1; k <= params.size(); k++) {
        if (!assigned.containsKey(k)) {
          throw new QueryValidationException(Kind.INVALID_OPERAND,
              "Raw SQL parameter $" + k + " is never referenced: " + sql);
        }
      }
    }
    return out.toString();
  }

  /** Index just past the block comment opening at {@code start}; block comments nest. Unterminated runs to the end. */
  static int skipBlockComment(String sql, int start) {
    int depth = 0;
    int i = start;
    while (i < sql.length()) {
      if (sql.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (sql.startsWith("*/", i)) {
        i += 2;
        if (--depth == 0) return i;
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /** Index just past the closing quote; doubled quotes are escapes. Unterminated runs to the end. */
  static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static int parseIndex(String digits, RawFragment raw) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "Raw SQL placeholder $" + digits + " is out of range: " + raw.sql(), e);
    }
  }
}
