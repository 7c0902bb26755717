package io.intellixity.pgvibe.builder;

import io.intellixity.pgvibe.dmlast.OnConflict;
import io.intellixity.pgvibe.ident.IdentifierParser;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/**
 * Immutable step builder for {@code ON CONFLICT}: pick a target with {@link #columns} or {@link #constraint},
 * then an action with {@link #doNothing()} or {@link #doUpdateSet(Map)}.
 */
public final class OnConflictBuilder {
  private final List<String> columns;
  private final String constraint;
  private final OnConflict.Action action;
  private final Map<String, Object> updates;

  private OnConflictBuilder(List<String> columns, String constraint, OnConflict.Action action, Map<String, Object> updates) {
    this.columns = columns;
    this.constraint = constraint;
    this.action = action;
    this.updates = updates;
  }

  static OnConflictBuilder start() {
    return new OnConflictBuilder(List.of(), null, null, Map.of());
  }

  public OnConflictBuilder columns(String... columns) {
    List<String> cols = new ArrayList<>();
    for (String c : columns) cols.add(checkColumn(c));
    if (cols.isEmpty()) throw new QueryValidationException(Kind.INVALID_OPERAND, "ON CONFLICT needs at least one column");
    return new OnConflictBuilder(List.copyOf(cols), null, action, updates);
  }

  public OnConflictBuilder constraint(String name) {
    return new OnConflictBuilder(List.of(), checkColumn(name), action, updates);
  }

  public OnConflictBuilder doNothing() {
    return new OnConflictBuilder(columns, constraint, OnConflict.Action.DO_NOTHING, Map.of());
  }

  /** {@code DO UPDATE SET col = $n, ...}; values are bound as parameters. */
  public OnConflictBuilder doUpdateSet(Map<String, ?> set) {
    if (set == null || set.isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "DO UPDATE SET needs at least one column");
    }
    Map<String, Object> m = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : set.entrySet()) m.put(checkColumn(e.getKey()), e.getValue());
    return new OnConflictBuilder(columns, constraint, OnConflict.Action.DO_UPDATE, m);
  }

  OnConflict build() {
    if (action == null) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "ON CONFLICT requires doNothing() or doUpdateSet(...)");
    }
    return new OnConflict(columns, constraint, action, updates);
  }

  static String checkColumn(String name) {
    if (name == null || name.isBlank()) {
      throw new QueryValidationException(Kind.EMPTY_IDENTIFIER, "Empty column name");
    }
    String n = name.trim();
    if (!IdentifierParser.isIdentifier(n)) {
      throw new QueryValidationException(Kind.MALFORMED_EXPRESSION, "Invalid expression \"" + name + "\": Invalid column name");
    }
    return n;
  }
}
