package io.intellixity.pgvibe.exec;

/** Failure while executing a compiled query; carries the SQL text that failed. */
public final class QueryExecutionException extends RuntimeException {
  private final String sql;

  public QueryExecutionException(String message, String sql, Throwable cause) {
    super(message + " [sql=" + sql + "]", cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}
