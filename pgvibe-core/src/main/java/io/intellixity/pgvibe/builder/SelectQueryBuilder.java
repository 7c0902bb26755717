package io.intellixity.pgvibe.builder;

import io.intellixity.pgvibe.dmlast.JoinClause;
import io.intellixity.pgvibe.dmlast.JoinType;
import io.intellixity.pgvibe.dmlast.OrderItem;
import io.intellixity.pgvibe.dmlast.SelectAst;
import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.ident.ColumnSpec;
import io.intellixity.pgvibe.ident.IdentifierParser;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.*;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.scope.Scope;
import io.intellixity.pgvibe.sql.CompiledQuery;
import io.intellixity.pgvibe.util.Chain;

import java.util.*;
import java.util.function.Function;

/**
 * Immutable SELECT builder. Every method returns a new snapshot; earlier snapshots stay valid and can be
 * branched or compiled from any thread.
 *
 * <p>Successive {@code where} calls combine with AND. Select-list items are validated against the final
 * scope when the query compiles, so they may name tables joined later.</p>
 */
public final class SelectQueryBuilder {
  private final QueryContext ctx;
  private final Scope scope;
  private final boolean distinct;
  private final Chain<ColumnSpec> selections;
  private final Chain<JoinClause> joins;
  private final Expression where;
  private final Chain<OrderItem> orderBy;
  private final Long limit;
  private final Long offset;

  private volatile CompiledQuery compiled;

  private SelectQueryBuilder(QueryContext ctx, Scope scope, boolean distinct, Chain<ColumnSpec> selections,
                             Chain<JoinClause> joins, Expression where, Chain<OrderItem> orderBy, Long limit, Long offset) {
    this.ctx = ctx;
    this.scope = scope;
    this.distinct = distinct;
    this.selections = selections;
    this.joins = joins;
    this.where = where;
    this.orderBy = orderBy;
    this.limit = limit;
    this.offset = offset;
  }

  public static SelectQueryBuilder from(QueryContext ctx, String tableExpression) {
    Objects.requireNonNull(ctx, "ctx");
    TableRef from = IdentifierParser.parseTableExpression(tableExpression);
    return new SelectQueryBuilder(ctx, Scope.of(from, ctx.schema()), false,
        Chain.empty(), Chain.empty(), null, Chain.empty(), null, null);
  }

  public Scope scope() { return scope; }

  public SelectQueryBuilder select(String... columns) { return select(Arrays.asList(columns)); }

  public SelectQueryBuilder select(List<String> columns) {
    Chain<ColumnSpec> next = selections;
    for (String c : columns) next = next.append(IdentifierParser.parseColumnExpression(c));
    return with(distinct, next, joins, where, orderBy, limit, offset, scope);
  }

  public SelectQueryBuilder selectAll() {
    return with(distinct, selections.append(new ColumnSpec(null, ColumnSpec.WILDCARD, null)),
        joins, where, orderBy, limit, offset, scope);
  }

  public SelectQueryBuilder distinct() {
    return with(true, selections, joins, where, orderBy, limit, offset, scope);
  }

  public SelectQueryBuilder where(String column, String operator, Object value) {
    return and(new ExpressionBuilder(scope).cmp(column, operator, value));
  }

  public SelectQueryBuilder where(Function<ExpressionBuilder, ? extends Expression> predicate) {
    Expression e = predicate.apply(new ExpressionBuilder(scope));
    if (e == null) throw new QueryValidationException(Kind.INVALID_OPERAND, "where callback returned null");
    return and(e);
  }

  /** All returned expressions joined with AND, added as one predicate. */
  public SelectQueryBuilder whereAll(Function<ExpressionBuilder, ? extends List<? extends Expression>> predicates) {
    ExpressionBuilder eb = new ExpressionBuilder(scope);
    List<? extends Expression> list = predicates.apply(eb);
    if (list == null) throw new QueryValidationException(Kind.INVALID_OPERAND, "whereAll callback returned null");
    return and(eb.and(list));
  }

  public SelectQueryBuilder where(RawFragment raw) {
    return and(Objects.requireNonNull(raw, "raw"));
  }

  public SelectQueryBuilder innerJoin(String table, String leftColumn, String rightColumn) {
    return join(JoinType.INNER, table, leftColumn, rightColumn);
  }

  public SelectQueryBuilder leftJoin(String table, String leftColumn, String rightColumn) {
    return join(JoinType.LEFT, table, leftColumn, rightColumn);
  }

  public SelectQueryBuilder rightJoin(String table, String leftColumn, String rightColumn) {
    return join(JoinType.RIGHT, table, leftColumn, rightColumn);
  }

  public SelectQueryBuilder fullJoin(String table, String leftColumn, String rightColumn) {
    return join(JoinType.FULL, table, leftColumn, rightColumn);
  }

  public SelectQueryBuilder orderBy(String column) {
    return orderBy(column, OrderItem.Direction.ASC);
  }

  public SelectQueryBuilder orderBy(String column, String direction) {
    return orderBy(column, OrderItem.Direction.parse(direction));
  }

  public SelectQueryBuilder orderBy(String column, OrderItem.Direction direction) {
    ColumnRef ref = scope.resolveColumn(column, null);
    return with(distinct, selections, joins, where, orderBy.append(new OrderItem(ref, direction)), limit, offset, scope);
  }

  public SelectQueryBuilder limit(long n) {
    return with(distinct, selections, joins, where, orderBy, nonNegative("limit", n), offset, scope);
  }

  public SelectQueryBuilder offset(long n) {
    return with(distinct, selections, joins, where, orderBy, limit, nonNegative("offset", n), scope);
  }

  /** Compiles once per snapshot; repeated calls return the same result. */
  public CompiledQuery compile() {
    CompiledQuery c = compiled;
    if (c == null) {
      c = ctx.dialect().compileSelect(toAst());
      compiled = c;
    }
    return c;
  }

  public CompiledQuery toSQL() { return compile(); }

  public List<Map<String, Object>> execute() {
    return ctx.requireExecutor().query(compile());
  }

  SelectAst toAst() {
    List<ColumnSpec> sel = selections.toList();
    for (ColumnSpec c : sel) scope.resolveSelection(c);
    return new SelectAst(scope.from(), distinct, sel, joins.toList(), where, orderBy.toList(), limit, offset);
  }

  private SelectQueryBuilder join(JoinType type, String tableExpression, String leftColumn, String rightColumn) {
    TableRef table = IdentifierParser.parseTableExpression(tableExpression);
    Scope next = scope.withTable(table);
    ColumnRef left = next.resolveColumn(leftColumn, scope.from().qualifier());
    ColumnRef right = next.resolveColumn(rightColumn, table.qualifier());
    return with(distinct, selections, joins.append(new JoinClause(type, table, left, right)),
        where, orderBy, limit, offset, next);
  }

  private SelectQueryBuilder and(Expression e) {
    Expression next;
    if (where == null) {
      next = e;
    } else if (where instanceof LogicalGroup g && g.clause() == Clause.AND) {
      next = g.with(e);
    } else {
      next = LogicalGroup.and(List.of(where, e));
    }
    return with(distinct, selections, joins, next, orderBy, limit, offset, scope);
  }

  private static Long nonNegative(String what, long n) {
    if (n < 0) throw new QueryValidationException(Kind.INVALID_OPERAND, what + " must be >= 0, got " + n);
    return n;
  }

  private SelectQueryBuilder with(boolean distinct, Chain<ColumnSpec> selections, Chain<JoinClause> joins,
                                  Expression where, Chain<OrderItem> orderBy, Long limit, Long offset, Scope scope) {
    return new SelectQueryBuilder(ctx, scope, distinct, selections, joins, where, orderBy, limit, offset);
  }
}
