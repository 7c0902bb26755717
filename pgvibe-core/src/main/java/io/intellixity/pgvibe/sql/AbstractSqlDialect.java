package io.intellixity.pgvibe.sql;

import io.intellixity.pgvibe.dmlast.*;
import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.ident.ColumnSpec;
import io.intellixity.pgvibe.ident.SqlKeywords;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.*;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * SQL rendering shared by dialects: clause assembly, identifier quoting, predicate parenthesization,
 * comparisons, raw fragments and multi-row INSERT.
 *
 * <p>Array and document operators, ON CONFLICT and RETURNING are dialect hooks; by default they throw.</p>
 *
 * <p>Parenthesization of logical groups:</p>
 * <ul>
 *   <li>an empty group renders its identity literal ({@code true} / {@code false}) bare;</li>
 *   <li>a one-element group at the WHERE root renders as its element;</li>
 *   <li>any other group is wrapped when it is not the root, has more than two children, or has a logical-group child;</li>
 *   <li>{@code NOT} renders its child as a root and wraps it unless the child already wrapped itself.</li>
 * </ul>
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractSqlDialect.class);
  private static final Pattern PLAIN_IDENT = Pattern.compile("[A-Za-z0-9_]+");

  /** One compilation pass: the placeholder counter and the parameters in placeholder order. */
  protected static final class RenderCtx {
    private final List<Object> params = new ArrayList<>();

    public String add(Object value) {
      params.add(value);
      return "$" + params.size();
    }

    public int size() { return params.size(); }

    List<Object> params() { return params; }
  }

  @Override
  public final CompiledQuery compileSelect(SelectAst select) {
    Objects.requireNonNull(select, "select");
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT ");
    if (select.distinct()) sql.append("DISTINCT ");
    if (select.selections().isEmpty()) {
      sql.append('*');
    } else {
      List<String> items = new ArrayList<>();
      for (ColumnSpec c : select.selections()) items.add(renderSelection(c));
      sql.append(String.join(", ", items));
    }
    sql.append(" FROM ").append(renderTable(select.from()));
    for (JoinClause j : select.joins()) {
      sql.append(' ').append(j.type().sql()).append(' ').append(renderTable(j.table()))
          .append(" ON ").append(renderColumn(j.left())).append(" = ").append(renderColumn(j.right()));
    }
    if (select.where() != null) {
      sql.append(" WHERE ").append(renderPredicate(select.where(), true, ctx));
    }
    if (!select.orderBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (OrderItem o : select.orderBy()) parts.add(renderColumn(o.column()) + " " + o.direction().name());
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }
    String out = applyLimitOffset(sql.toString(), select.limit(), select.offset());
    return done("select", out, ctx);
  }

  @Override
  public final CompiledQuery compileInsert(InsertAst insert) {
    Objects.requireNonNull(insert, "insert");
    if (insert.rows().isEmpty() || insert.columns().isEmpty()) {
      throw new QueryValidationException(Kind.INVALID_OPERAND,
          "INSERT INTO " + insert.table().name() + " requires at least one row with at least one column");
    }
    RenderCtx ctx = new RenderCtx();
    List<String> cols = insert.columns().stream().map(this::quoteIdent).toList();
    List<String> tuples = new ArrayList<>();
    for (List<Object> row : insert.rows()) {
      if (row.size() != cols.size()) {
        throw new IllegalArgumentException("Row has " + row.size() + " values for " + cols.size() + " columns");
      }
      List<String> ph = new ArrayList<>(row.size());
      for (Object v : row) ph.add(ctx.add(v));
      tuples.add("(" + String.join(", ", ph) + ")");
    }
    String sql = "INSERT INTO " + renderTable(insert.table()) +
        " (" + String.join(", ", cols) + ") VALUES " + String.join(", ", tuples);
    if (insert.onConflict() != null) sql = applyOnConflict(sql, insert.onConflict(), ctx);
    if (!insert.returning().isEmpty()) sql = applyReturning(sql, insert.returning());
    return done("insert", sql, ctx);
  }

  /** Default renders {@code LIMIT n OFFSET m}. */
  protected String applyLimitOffset(String sql, Long limit, Long offset) {
    StringBuilder sb = new StringBuilder(sql);
    if (limit != null) sb.append(" LIMIT ").append(limit);
    if (offset != null) sb.append(" OFFSET ").append(offset);
    return sb.toString();
  }

  protected String applyOnConflict(String insertSql, OnConflict onConflict, RenderCtx ctx) {
    throw new IllegalArgumentException("ON CONFLICT is not supported by dialect: " + id());
  }

  protected String applyReturning(String insertSql, List<String> returning) {
    throw new IllegalArgumentException("RETURNING is not supported by dialect: " + id());
  }

  protected String renderArray(ArrayCondition c, String column, RenderCtx ctx) {
    throw new IllegalArgumentException("Array operator " + c.operator() + " is not supported by dialect: " + id());
  }

  protected String renderJson(JsonCondition c, String column, RenderCtx ctx) {
    throw new IllegalArgumentException("Document operator " + c.operator() + " is not supported by dialect: " + id());
  }

  /** Quotes only identifiers that are reserved words or contain characters outside {@code [A-Za-z0-9_]}. */
  protected String quoteIdent(String ident) {
    if (PLAIN_IDENT.matcher(ident).matches() && !SqlKeywords.isReserved(ident)) return ident;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** Single-quoted SQL string literal. */
  protected static String stringLiteral(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected String renderTable(TableRef t) {
    return t.aliased() ? quoteIdent(t.name()) + " AS " + quoteIdent(t.alias()) : quoteIdent(t.name());
  }

  protected String renderColumn(ColumnRef c) {
    return c.isQualified() ? quoteIdent(c.qualifier()) + "." + quoteIdent(c.column()) : quoteIdent(c.column());
  }

  private String renderSelection(ColumnSpec c) {
    if (c.isWildcard()) return c.qualifier() == null ? "*" : quoteIdent(c.qualifier()) + ".*";
    String col = renderColumn(c.ref());
    return c.alias() == null ? col : col + " AS " + quoteIdent(c.alias());
  }

  protected final String renderPredicate(Expression e, boolean root, RenderCtx ctx) {
    return e.accept(new PredicateRenderer(ctx, root));
  }

  /** Whether a non-empty group renders with its own parentheses at the given position. */
  static boolean wrapsItself(LogicalGroup g, boolean root) {
    if (g.isEmpty()) return false;
    if (root && g.elements().size() == 1) {
      return g.elements().get(0) instanceof LogicalGroup only && wrapsItself(only, true);
    }
    if (!root || g.elements().size() > 2) return true;
    for (Expression child : g.elements()) {
      if (child instanceof LogicalGroup) return true;
    }
    return false;
  }

  private final class PredicateRenderer implements ExpressionVisitor<String> {
    private final RenderCtx ctx;
    private final boolean root;

    PredicateRenderer(RenderCtx ctx, boolean root) {
      this.ctx = ctx;
      this.root = root;
    }

    @Override
    public String visit(Comparison c) {
      String col = renderColumn(c.column());
      ComparisonOperator op = c.operator();
      if (c.comparesColumns()) return col + " " + op.sql() + " " + renderColumn((ColumnRef) c.value());
      switch (op) {
        case IS:
          return col + " IS NULL";
        case IS_NOT:
          return col + " IS NOT NULL";
        case IN:
        case NOT_IN: {
          List<Object> vals = c.values();
          if (vals.isEmpty()) return op == ComparisonOperator.IN ? "false" : "true";
          List<String> ph = new ArrayList<>(vals.size());
          for (Object v : vals) ph.add(ctx.add(v));
          return col + " " + op.sql() + " (" + String.join(", ", ph) + ")";
        }
        default:
          if (c.value() == null) return col + (op == ComparisonOperator.EQ ? " IS NULL" : " IS NOT NULL");
          return col + " " + op.sql() + " " + ctx.add(c.value());
      }
    }

    @Override
    public String visit(LogicalGroup g) {
      if (g.isEmpty()) return g.clause().emptyLiteral();
      // a one-element root group renders as its element
      if (root && g.elements().size() == 1) return renderPredicate(g.elements().get(0), true, ctx);
      List<String> parts = new ArrayList<>(g.elements().size());
      for (Expression child : g.elements()) parts.add(renderPredicate(child, false, ctx));
      String joined = String.join(g.clause().separator(), parts);
      return wrapsItself(g, root) ? "(" + joined + ")" : joined;
    }

    @Override
    public String visit(NotElement n) {
      Expression child = n.element();
      String inner = renderPredicate(child, true, ctx);
      if (child instanceof LogicalGroup g && wrapsItself(g, true)) return "NOT " + inner;
      return "NOT (" + inner + ")";
    }

    @Override
    public String visit(ArrayCondition a) {
      return renderArray(a, renderColumn(a.column()), ctx);
    }

    @Override
    public String visit(JsonCondition j) {
      return renderJson(j, renderColumn(j.column()), ctx);
    }

    @Override
    public String visit(RawFragment r) {
      return RawSqlRenumberer.renumber(r, ctx::add);
    }
  }

  private CompiledQuery done(String op, String sql, RenderCtx ctx) {
    CompiledQuery q = new CompiledQuery(sql, ctx.params());
    if (log.isDebugEnabled()) {
      log.debug("pgvibe.compile op={} dialect={} paramCount={} sql={}", op, id(), q.parameters().size(), sql);
      if (log.isTraceEnabled()) {
        int idx = 1;
        for (Object v : q.parameters()) {
          log.trace("pgvibe.compile param index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
        }
      }
    }
    return q;
  }
}
