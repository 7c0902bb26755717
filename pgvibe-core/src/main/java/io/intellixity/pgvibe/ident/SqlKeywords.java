package io.intellixity.pgvibe.ident;

import java.util.Locale;
import java.util.Set;

/** Reserved words that may not be used as aliases and that force identifier quoting. */
public final class SqlKeywords {
  private SqlKeywords() {}

  private static final Set<String> RESERVED = Set.of(
      "all", "alter", "and", "any", "as", "asc", "between", "by", "case", "create",
      "database", "delete", "desc", "distinct", "drop", "else", "end", "except",
      "exists", "false", "from", "function", "grant", "group", "having", "ilike",
      "in", "index", "inner", "insert", "intersect", "into", "is", "join", "left",
      "like", "limit", "not", "null", "offset", "on", "or", "order", "outer",
      "procedure", "recursive", "revoke", "right", "role", "schema", "select", "set",
      "similar", "some", "table", "then", "trigger", "true", "union", "update", "user",
      "values", "view", "when", "where", "with"
  );

  public static boolean isReserved(String word) {
    return word != null && RESERVED.contains(word.toLowerCase(Locale.ROOT));
  }
}
