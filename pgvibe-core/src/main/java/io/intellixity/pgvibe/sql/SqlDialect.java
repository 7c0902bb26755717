package io.intellixity.pgvibe.sql;

import io.intellixity.pgvibe.dmlast.InsertAst;
import io.intellixity.pgvibe.dmlast.SelectAst;

/** Compiles statement ASTs to SQL text plus positional parameters. Implementations are stateless and thread-safe. */
public interface SqlDialect {
  String id();

  CompiledQuery compileSelect(SelectAst select);

  CompiledQuery compileInsert(InsertAst insert);
}
