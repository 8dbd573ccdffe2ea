package io.intellixity.classql.jdbc;

import io.intellixity.classql.compile.CompiledQuery;
import io.intellixity.classql.compile.QueryCompiler;
import io.intellixity.classql.query.JoinDescription;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.result.QueryResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a description, executes it once and works out which columns to display.
 *
 * Display columns are the primary columns followed by each join's columns;
 * when none were requested, the store's column list is used.
 */
public final class QueryRunner {
  private final JdbcQueryExecutor executor;

  public QueryRunner(JdbcQueryExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public QueryOutput run(QueryDescription query) {
    CompiledQuery compiled = QueryCompiler.compile(query);
    QueryResult result = executor.execute(compiled);
    return new QueryOutput(compiled.sql(), compiled.params(), result.rows(), displayColumns(query, result));
  }

  static List<String> displayColumns(QueryDescription query, QueryResult result) {
    List<String> out = new ArrayList<>(query.columns());
    for (JoinDescription j : query.joins()) out.addAll(j.columns());
    return out.isEmpty() ? result.columns() : out;
  }
}
