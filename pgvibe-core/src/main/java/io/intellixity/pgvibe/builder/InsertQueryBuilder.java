package io.intellixity.pgvibe.builder;

import io.intellixity.pgvibe.dmlast.InsertAst;
import io.intellixity.pgvibe.dmlast.OnConflict;
import io.intellixity.pgvibe.ident.IdentifierParser;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.sql.CompiledQuery;
import io.intellixity.pgvibe.util.Chain;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Immutable INSERT builder.
 *
 * <p>The column list comes from the first row, in its iteration order. Later rows may omit columns
 * (bound as null) but may not introduce new ones.</p>
 */
public final class InsertQueryBuilder {
  private final QueryContext ctx;
  private final TableRef table;
  private final Chain<Map<String, Object>> rows;
  private final OnConflict onConflict;
  private final List<String> returning;

  private volatile CompiledQuery compiled;

  private InsertQueryBuilder(QueryContext ctx, TableRef table, Chain<Map<String, Object>> rows,
                             OnConflict onConflict, List<String> returning) {
    this.ctx = ctx;
    this.table = table;
    this.rows = rows;
    this.onConflict = onConflict;
    this.returning = returning;
  }

  public static InsertQueryBuilder into(QueryContext ctx, String tableExpression) {
    Objects.requireNonNull(ctx, "ctx");
    return new InsertQueryBuilder(ctx, IdentifierParser.parseTableExpression(tableExpression),
        Chain.empty(), null, List.of());
  }

  public InsertQueryBuilder values(Map<String, ?> row) {
    return values(List.of(Objects.requireNonNull(row, "row")));
  }

  public InsertQueryBuilder values(List<? extends Map<String, ?>> rows) {
    Chain<Map<String, Object>> next = this.rows;
    for (Map<String, ?> r : rows) {
      if (r == null || r.isEmpty()) {
        throw new QueryValidationException(Kind.INVALID_OPERAND, "INSERT row for '" + table.name() + "' has no columns");
      }
      // values may be null, so no Map.copyOf
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<String, ?> e : r.entrySet()) copy.put(OnConflictBuilder.checkColumn(e.getKey()), e.getValue());
      next = next.append(Collections.unmodifiableMap(copy));
    }
    return new InsertQueryBuilder(ctx, table, next, onConflict, returning);
  }

  public InsertQueryBuilder returning(String... columns) {
    List<String> cols = new ArrayList<>(returning);
    for (String c : columns) cols.add(OnConflictBuilder.checkColumn(c));
    return new InsertQueryBuilder(ctx, table, rows, onConflict, List.copyOf(cols));
  }

  /** Adds {@code *} to the RETURNING list; columns named before or after it are kept. */
  public InsertQueryBuilder returningAll() {
    if (returning.contains("*")) return this;
    List<String> cols = new ArrayList<>(returning);
    cols.add("*");
    return new InsertQueryBuilder(ctx, table, rows, onConflict, List.copyOf(cols));
  }

  public InsertQueryBuilder onConflict(UnaryOperator<OnConflictBuilder> conflict) {
    OnConflictBuilder b = conflict.apply(OnConflictBuilder.start());
    if (b == null) throw new QueryValidationException(Kind.INVALID_OPERAND, "onConflict callback returned null");
    return new InsertQueryBuilder(ctx, table, rows, b.build(), returning);
  }

  public CompiledQuery compile() {
    CompiledQuery c = compiled;
    if (c == null) {
      c = ctx.dialect().compileInsert(toAst());
      compiled = c;
    }
    return c;
  }

  public CompiledQuery toSQL() { return compile(); }

  /** Returned rows when RETURNING was requested, otherwise an empty list. */
  public List<Map<String, Object>> execute() {
    if (returning.isEmpty()) {
      ctx.requireExecutor().update(compile());
      return List.of();
    }
    return ctx.requireExecutor().query(compile());
  }

  public long executeUpdate() {
    return ctx.requireExecutor().update(compile());
  }

  InsertAst toAst() {
    List<Map<String, Object>> rs = rows.toList();
    if (rs.isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "INSERT INTO " + table.name() + " requires values(...)");
    }
    List<String> columns = new ArrayList<>(rs.get(0).keySet());
    List<List<Object>> tuples = new ArrayList<>(rs.size());
    for (Map<String, Object> r : rs) {
      for (String k : r.keySet()) {
        if (!columns.contains(k)) {
          throw new QueryValidationException(Kind.INVALID_OPERAND,
              "INSERT row introduces column '" + k + "' missing from the first row " + columns);
        }
      }
      List<Object> t = new ArrayList<>(columns.size());
      for (String c : columns) t.add(r.get(c));
      tuples.add(t);
    }
    return new InsertAst(table, columns, tuples, onConflict, returning);
  }
}
