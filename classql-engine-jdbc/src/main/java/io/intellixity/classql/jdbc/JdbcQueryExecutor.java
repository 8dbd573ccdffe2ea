package io.intellixity.classql.jdbc;

import io.intellixity.classql.compile.Bind;
import io.intellixity.classql.compile.CompiledQuery;
import io.intellixity.classql.jdbc.bind.JdbcBinders;
import io.intellixity.classql.result.QueryResult;
import io.intellixity.classql.result.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes compiled statements against a JDBC {@link javax.sql.DataSource}.
 *
 * Each call borrows one connection and reads the full result set before returning.
 * Retries and transactions are left to the caller.
 */
public final class JdbcQueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final JdbcHandle handle;
  private final JdbcBinders binders;

  public JdbcQueryExecutor(JdbcHandle handle) {
    this(handle, JdbcBinders.defaults());
  }

  public JdbcQueryExecutor(JdbcHandle handle, JdbcBinders binders) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  public JdbcHandle handle() { return handle; }

  public QueryResult execute(CompiledQuery query) {
    Objects.requireNonNull(query, "query");
    long start = System.nanoTime();
    debugSql(query);
    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(query.sql())) {
      binders.bindAll(ps, query.binds());
      try (ResultSet rs = ps.executeQuery()) {
        QueryResult result = readAll(rs);
        debugDone(result.rows().size(), System.nanoTime() - start);
        return result;
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e);
    }
  }

  private static QueryResult readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> columns = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) columns.add(md.getColumnLabel(i));

    List<ResultRow> rows = new ArrayList<>();
    while (rs.next()) {
      ResultRow.Builder row = ResultRow.builder();
      for (int i = 1; i <= n; i++) {
        row.put(columns.get(i - 1), JdbcValues.normalize(rs.getObject(i)));
      }
      rows.add(row.build());
    }
    return new QueryResult(columns, rows);
  }

  private void debugSql(CompiledQuery query) {
    if (!log.isDebugEnabled()) return;
    log.debug("classql.jdbc op=SELECT bindCount={} handleId={} sql={}",
        query.binds().size(), handle.id(), query.sql());

    // TRACE: bind summary only, no raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : query.binds()) {
        Object v = b.value();
        log.trace("classql.jdbc bind index={} userTypeId={} valueType={} valueLen={}",
            idx++, b.userTypeId(), v == null ? "null" : v.getClass().getName(),
            (v instanceof CharSequence cs) ? cs.length() : -1);
      }
    }
  }

  private void debugDone(int rowCount, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("classql.jdbc_done op=SELECT handleId={} durationMs={} rows={}",
        handle.id(), durationNanos / 1_000_000.0, rowCount);
  }
}
