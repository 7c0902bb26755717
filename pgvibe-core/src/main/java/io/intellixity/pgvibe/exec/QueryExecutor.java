package io.intellixity.pgvibe.exec;

import io.intellixity.pgvibe.sql.CompiledQuery;

import java.util.List;
import java.util.Map;

/** Runs compiled queries. Implementations wrap driver failures in {@link QueryExecutionException}. */
public interface QueryExecutor {
  /** Rows keyed by column label, in column order. */
  List<Map<String, Object>> query(CompiledQuery query);

  /** @return affected row count */
  long update(CompiledQuery query);
}
