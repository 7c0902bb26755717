package io.intellixity.pgvibe.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code $n} placeholders to JDBC {@code ?} markers.
 *
 * <p>Quoted literals, quoted identifiers, line comments and block comments are copied untouched. A literal {@code ?}
 * elsewhere (the jsonb {@code ?}, {@code ?|}, {@code ?&} operators) is escaped as {@code ??} so the driver
 * does not take it for a parameter.</p>
 */
public final class PositionalSqlRewriter {
  private PositionalSqlRewriter() {}

  /**
   * @param sql JDBC text
   * @param parameterIndexes zero-based index into the compiled parameters for each {@code ?}, in order;
   *     a {@code $n} used twice appears twice
   */
  public record Rewritten(String sql, List<Integer> parameterIndexes) {
    public Rewritten {
      parameterIndexes = List.copyOf(parameterIndexes);
    }
  }

  public static Rewritten rewrite(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    List<Integer> indexes = new ArrayList<>();
    int n = sql.length();
    int i = 0;
    while (i < n) {
      char ch = sql.charAt(i);
      if (ch == '\'' || ch == '"') {
        int end = skipQuoted(sql, i, ch);
        out.append(sql, i, end);
        i = end;
      } else if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = end < 0 ? n : end;
        out.append(sql, i, end);
        i = end;
      } else if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = skipBlockComment(sql, i);
        out.append(sql, i, end);
        i = end;
      } else if (ch == '$' && i + 1 < n && Character.isDigit(sql.charAt(i + 1))) {
        int j = i + 1;
        while (j < n && Character.isDigit(sql.charAt(j))) j++;
        indexes.add(Integer.parseInt(sql.substring(i + 1, j)) - 1);
        out.append('?');
        i = j;
      } else if (ch == '?') {
        out.append("??");
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return new Rewritten(out.toString(), indexes);
  }

  /** Index just past the block comment opening at {@code start}; block comments nest. Unterminated runs to the end. */
  private static int skipBlockComment(String sql, int start) {
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

  private static int skipQuoted(String sql, int start, char quote) {
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
}
