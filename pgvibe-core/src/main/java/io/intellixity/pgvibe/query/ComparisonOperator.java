package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.Locale;

public enum ComparisonOperator {
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  LIKE("LIKE"),
  ILIKE("ILIKE"),
  IN("IN"),
  NOT_IN("NOT IN"),
  IS("IS"),
  IS_NOT("IS NOT");

  private final String sql;

  ComparisonOperator(String sql) { this.sql = sql; }

  public String sql() { return sql; }

  public boolean isCollectionOperator() { return this == IN || this == NOT_IN; }

  public boolean isNullOperator() { return this == IS || this == IS_NOT; }

  /** Parses {@code "="}, {@code "<>"}, {@code "not in"}, {@code "IS  NOT"} etc. Case and inner whitespace are ignored. */
  public static ComparisonOperator parse(String op) {
    if (op == null) throw new QueryValidationException(Kind.INVALID_OPERAND, "Operator is required");
    String norm = op.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    switch (norm) {
      case "=": return EQ;
      case "!=":
      case "<>": return NE;
      case "<": return LT;
      case "<=": return LE;
      case ">": return GT;
      case ">=": return GE;
      case "like": return LIKE;
      case "ilike": return ILIKE;
      case "in": return IN;
      case "not in": return NOT_IN;
      case "is": return IS;
      case "is not": return IS_NOT;
      default:
        throw new QueryValidationException(Kind.INVALID_OPERAND, "Unsupported operator: '" + op + "'");
    }
  }
}
