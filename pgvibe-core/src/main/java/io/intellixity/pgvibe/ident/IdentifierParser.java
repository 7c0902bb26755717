package io.intellixity.pgvibe.ident;

import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.regex.Pattern;

/**
 * Parses {@code "table as alias"} and {@code "column as alias"} expressions.
 *
 * <p>The {@code AS} keyword is matched case-insensitively and must be surrounded by whitespace.
 * Surrounding whitespace of the name and the alias is ignored. Implicit aliases
 * ({@code "users u"}) are not accepted.</p>
 */
public final class IdentifierParser {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern WS = Pattern.compile("\\s+");

  private IdentifierParser() {}

  public static boolean isIdentifier(String s) {
    return s != null && IDENT.matcher(s).matches();
  }

  public static TableRef parseTableExpression(String input) {
    String[] parts = splitAlias(input, "table");
    String table = parts[0];
    if (!isIdentifier(table)) {
      throw malformed(input, "Invalid table name \"" + table + "\"");
    }
    String alias = parts[1];
    if (alias != null) checkAlias(input, alias);
    return new TableRef(table, alias);
  }

  /** Parses a select-list item: {@code col}, {@code q.col}, {@code *}, {@code q.*}, each optionally {@code AS alias}. */
  public static ColumnSpec parseColumnExpression(String input) {
    String[] parts = splitAlias(input, "column");
    String name = parts[0];
    String alias = parts[1];

    String qualifier = null;
    String column = name;
    int dot = name.indexOf('.');
    if (dot >= 0) {
      qualifier = name.substring(0, dot);
      column = name.substring(dot + 1);
      if (!isIdentifier(qualifier)) {
        throw malformed(input, "Invalid qualifier \"" + qualifier + "\"");
      }
    }

    if (ColumnSpec.WILDCARD.equals(column)) {
      if (alias != null) throw malformed(input, "A wildcard selection cannot be aliased");
    } else if (!isIdentifier(column)) {
      throw malformed(input, "Invalid column name \"" + column + "\"");
    }

    if (alias != null) checkAlias(input, alias);
    return new ColumnSpec(qualifier, column, alias);
  }

  /** Parses a plain column reference ({@code col} or {@code q.col}); aliases and wildcards are rejected. */
  public static ColumnRef parseColumnReference(String input) {
    if (input == null || input.isBlank()) {
      throw new QueryValidationException(Kind.EMPTY_IDENTIFIER, "Empty column reference");
    }
    ColumnSpec spec = parseColumnExpression(input);
    if (spec.alias() != null) {
      throw malformed(input, "A column alias is only allowed in the select list");
    }
    if (spec.isWildcard()) {
      throw malformed(input, "A wildcard is only allowed in the select list");
    }
    return spec.ref();
  }

  private static String[] splitAlias(String input, String what) {
    if (input == null || input.isBlank()) {
      throw malformed(input, "Empty " + what + " expression");
    }
    String[] tokens = WS.split(input.trim());
    if (tokens.length == 1) {
      if (isAsKeyword(tokens[0])) throw malformed(input, "Missing " + what + " name before AS");
      return new String[] { tokens[0], null };
    }
    if (tokens.length == 2) {
      if (isAsKeyword(tokens[0])) throw malformed(input, "Missing " + what + " name before AS");
      if (isAsKeyword(tokens[1])) throw malformed(input, "Dangling AS without an alias");
      throw malformed(input, "Expected \"<" + what + "> AS <alias>\"");
    }
    if (tokens.length == 3 && isAsKeyword(tokens[1])) {
      return new String[] { tokens[0], tokens[2] };
    }
    throw malformed(input, "Expected \"<" + what + "> AS <alias>\"");
  }

  private static void checkAlias(String input, String alias) {
    if (!isIdentifier(alias)) {
      throw malformed(input, "Invalid alias \"" + alias + "\"");
    }
    if (SqlKeywords.isReserved(alias)) {
      throw malformed(input, "Alias \"" + alias + "\" is a reserved SQL keyword");
    }
  }

  private static boolean isAsKeyword(String token) {
    return "as".equalsIgnoreCase(token);
  }

  private static QueryValidationException malformed(String input, String reason) {
    return new QueryValidationException(Kind.MALFORMED_EXPRESSION,
        "Invalid expression \"" + input + "\": " + reason);
  }
}
