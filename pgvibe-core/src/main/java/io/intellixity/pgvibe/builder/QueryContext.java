package io.intellixity.pgvibe.builder;

import io.intellixity.pgvibe.exec.QueryExecutor;
import io.intellixity.pgvibe.scope.DatabaseSchema;
import io.intellixity.pgvibe.sql.SqlDialect;

import java.util.Objects;

/** Collaborators shared by every builder created from one entry point. {@code schema} and {@code executor} may be null. */
public record QueryContext(SqlDialect dialect, DatabaseSchema schema, QueryExecutor executor) {
  public QueryContext {
    Objects.requireNonNull(dialect, "dialect");
  }

  QueryExecutor requireExecutor() {
    if (executor == null) {
      throw new IllegalStateException("No QueryExecutor configured; create the entry point with an executor to run queries");
    }
    return executor;
  }
}
