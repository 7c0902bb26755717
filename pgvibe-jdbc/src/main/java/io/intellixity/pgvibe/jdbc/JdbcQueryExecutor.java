package io.intellixity.pgvibe.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgvibe.exec.QueryExecutionException;
import io.intellixity.pgvibe.exec.QueryExecutor;
import io.intellixity.pgvibe.jdbc.bind.DiscoveredBinderRegistry;
import io.intellixity.pgvibe.sql.CompiledQuery;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * Runs compiled queries over JDBC, one pooled connection per call in auto-commit mode.
 *
 * <p>Rows are read into insertion-ordered maps keyed by column label. SQL arrays become lists and
 * json/jsonb values are parsed with Jackson.</p>
 */
public final class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private final DataSource dataSource;
  private final DiscoveredBinderRegistry binders;

  public JdbcQueryExecutor(DataSource dataSource) {
    this(dataSource, new DiscoveredBinderRegistry("postgres"));
  }

  public JdbcQueryExecutor(DataSource dataSource, DiscoveredBinderRegistry binders) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  @Override
  public List<Map<String, Object>> query(CompiledQuery query) {
    PositionalSqlRewriter.Rewritten rw = PositionalSqlRewriter.rewrite(query.sql());
    debugSql("query", query, rw);
    long t0 = System.nanoTime();
    try (Connection c = dataSource.getConnection();
         PreparedStatement ps = c.prepareStatement(rw.sql())) {
      bindAll(ps, query, rw);
      List<Map<String, Object>> rows;
      try (ResultSet rs = ps.executeQuery()) {
        rows = readRows(rs);
      }
      debugDone("query", rows.size(), System.nanoTime() - t0);
      return rows;
    } catch (SQLException e) {
      throw new QueryExecutionException("Query failed: " + e.getMessage(), query.sql(), e);
    }
  }

  @Override
  public long update(CompiledQuery query) {
    PositionalSqlRewriter.Rewritten rw = PositionalSqlRewriter.rewrite(query.sql());
    debugSql("update", query, rw);
    long t0 = System.nanoTime();
    try (Connection c = dataSource.getConnection();
         PreparedStatement ps = c.prepareStatement(rw.sql())) {
      bindAll(ps, query, rw);
      long n = ps.executeUpdate();
      debugDone("update", n, System.nanoTime() - t0);
      return n;
    } catch (SQLException e) {
      throw new QueryExecutionException("Update failed: " + e.getMessage(), query.sql(), e);
    }
  }

  private void bindAll(PreparedStatement ps, CompiledQuery query, PositionalSqlRewriter.Rewritten rw) throws SQLException {
    List<Object> params = query.parameters();
    int pos = 1;
    for (int idx : rw.parameterIndexes()) {
      if (idx < 0 || idx >= params.size()) {
        throw new QueryExecutionException("Placeholder $" + (idx + 1) + " has no parameter (" + params.size() + " given)",
            query.sql(), null);
      }
      binders.bind(ps, pos++, params.get(idx));
    }
  }

  static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      // values may be null, so no Map.of
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= cols; i++) {
        row.put(md.getColumnLabel(i), readValue(rs.getObject(i)));
      }
      out.add(row);
    }
    return out;
  }

  private static Object readValue(Object v) throws SQLException {
    if (v instanceof Array a) {
      try {
        Object arr = a.getArray();
        return arr instanceof Object[] os ? new ArrayList<>(Arrays.asList(os)) : arr;
      } finally {
        a.free();
      }
    }
    if (v instanceof PGobject pg && pg.getValue() != null
        && ("jsonb".equals(pg.getType()) || "json".equals(pg.getType()))) {
      try {
        return JSON.readValue(pg.getValue(), Object.class);
      } catch (JsonProcessingException e) {
        throw new SQLException("Cannot parse " + pg.getType() + " column value", e);
      }
    }
    return v;
  }

  private void debugSql(String op, CompiledQuery q, PositionalSqlRewriter.Rewritten rw) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgvibe.jdbc op={} dialectId={} bindCount={} sql={}",
        op, binders.dialectId(), rw.parameterIndexes().size(), rw.sql());

    // TRACE: bind summary only, never values
    if (log.isTraceEnabled()) {
      int pos = 1;
      for (int idx : rw.parameterIndexes()) {
        Object v = idx >= 0 && idx < q.parameters().size() ? q.parameters().get(idx) : null;
        log.trace("pgvibe.jdbc bind index={} param=${} valueType={} valueLen={}",
            pos++, idx + 1, v == null ? "null" : v.getClass().getName(),
            v instanceof CharSequence cs ? cs.length() : -1);
      }
    }
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pgvibe.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
