package io.intellixity.pgvibe;

import io.intellixity.pgvibe.builder.InsertQueryBuilder;
import io.intellixity.pgvibe.builder.QueryContext;
import io.intellixity.pgvibe.builder.SelectQueryBuilder;
import io.intellixity.pgvibe.exec.QueryExecutor;
import io.intellixity.pgvibe.scope.DatabaseSchema;
import io.intellixity.pgvibe.sql.SqlDialect;
import io.intellixity.pgvibe.sql.postgres.PostgresDialect;

/**
 * Entry point for building PostgreSQL queries.
 *
 * <pre>
 * CompiledQuery q = PgVibe.create()
 *     .selectFrom("users as u")
 *     .select("u.id", "u.name")
 *     .where("u.active", "=", true)
 *     .compile();
 * </pre>
 */
public final class PgVibe {
  private final QueryContext ctx;

  private PgVibe(QueryContext ctx) {
    this.ctx = ctx;
  }

  public static PgVibe create() { return create(null, null); }

  public static PgVibe create(DatabaseSchema schema) { return create(schema, null); }

  public static PgVibe create(DatabaseSchema schema, QueryExecutor executor) {
    return new PgVibe(new QueryContext(new PostgresDialect(), schema, executor));
  }

  public static PgVibe create(SqlDialect dialect, DatabaseSchema schema, QueryExecutor executor) {
    return new PgVibe(new QueryContext(dialect, schema, executor));
  }

  public PgVibe withExecutor(QueryExecutor executor) {
    return new PgVibe(new QueryContext(ctx.dialect(), ctx.schema(), executor));
  }

  public SelectQueryBuilder selectFrom(String tableExpression) {
    return SelectQueryBuilder.from(ctx, tableExpression);
  }

  public InsertQueryBuilder insertInto(String tableExpression) {
    return InsertQueryBuilder.into(ctx, tableExpression);
  }
}
