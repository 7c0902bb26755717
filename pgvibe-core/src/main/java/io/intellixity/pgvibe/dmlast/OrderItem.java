package io.intellixity.pgvibe.dmlast;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.Locale;
import java.util.Objects;

public record OrderItem(ColumnRef column, Direction direction) {
  public OrderItem {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    public static Direction parse(String s) {
      if (s != null) {
        String norm = s.trim().toUpperCase(Locale.ROOT);
        if (norm.equals("ASC")) return ASC;
        if (norm.equals("DESC")) return DESC;
      }
      throw new QueryValidationException(Kind.INVALID_OPERAND, "Invalid sort direction: '" + s + "' (expected asc or desc)");
    }
  }
}
