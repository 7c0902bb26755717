package io.intellixity.pgvibe.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.pgvibe.PgVibe;
import io.intellixity.pgvibe.scope.DatabaseSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** HikariCP pools and ready-to-run entry points from {@link PgVibeJdbcSettings}. */
public final class PgVibeDataSources {
  private static final Logger log = LoggerFactory.getLogger(PgVibeDataSources.class);

  private PgVibeDataSources() {}

  public static HikariConfig toHikariConfig(PgVibeJdbcSettings s) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(s.url());
    hc.setUsername(s.username());
    hc.setPassword(s.password());
    hc.setSchema(s.schema());
    hc.setMaximumPoolSize(s.maximumPoolSize());
    hc.setConnectionTimeout(s.connectionTimeoutMs());
    hc.setPoolName("pgvibe");
    return hc;
  }

  public static HikariDataSource create(PgVibeJdbcSettings s) {
    log.info("pgvibe.jdbc pool url={} schema={} maximumPoolSize={}", s.url(), s.schema(), s.maximumPoolSize());
    return new HikariDataSource(toHikariConfig(s));
  }

  /** Entry point that executes against {@code dataSource}; the caller owns (and closes) the pool. */
  public static PgVibe connect(javax.sql.DataSource dataSource, DatabaseSchema schema) {
    return PgVibe.create(schema, new JdbcQueryExecutor(dataSource));
  }
}
