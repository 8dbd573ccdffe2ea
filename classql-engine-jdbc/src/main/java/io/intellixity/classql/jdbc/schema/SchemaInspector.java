package io.intellixity.classql.jdbc.schema;

import io.intellixity.classql.compile.Identifiers;
import io.intellixity.classql.compile.QueryCompiler;
import io.intellixity.classql.jdbc.JdbcQueryExecutor;
import io.intellixity.classql.jdbc.QueryExecutionException;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.result.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes the user tables of a store.
 *
 * <p>Tables come from {@link DatabaseMetaData}; SQLite internal tables ({@code sqlite_*}) are skipped
 * and names that are not safe identifiers are logged and left out, so no unvalidated name
 * reaches a statement.</p>
 */
public final class SchemaInspector {
  private static final Logger log = LoggerFactory.getLogger(SchemaInspector.class);
  private static final String INTERNAL_PREFIX = "sqlite_";

  private final JdbcQueryExecutor executor;

  public SchemaInspector(JdbcQueryExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public List<TableInfo> describe(int sampleRows) {
    List<TableInfo> tables = new ArrayList<>();
    try (Connection c = executor.handle().client().getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      for (String table : tableNames(md)) {
        tables.add(new TableInfo(table, columns(md, table), rowCount(c, table), List.of()));
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to read schema: " + e.getMessage(), e);
    }

    // samples run after the metadata connection is released; a pool of one must not starve
    List<TableInfo> out = new ArrayList<>(tables.size());
    for (TableInfo t : tables) {
      out.add(new TableInfo(t.name(), t.columns(), t.rowCount(), sample(t.name(), sampleRows)));
    }
    log.debug("classql.schema described tables={} sampleRows={}", out.size(), sampleRows);
    return out;
  }

  private static List<String> tableNames(DatabaseMetaData md) throws SQLException {
    List<String> names = new ArrayList<>();
    try (ResultSet rs = md.getTables(null, null, "%", new String[]{"TABLE"})) {
      while (rs.next()) {
        String name = rs.getString("TABLE_NAME");
        if (name == null || name.toLowerCase(Locale.ROOT).startsWith(INTERNAL_PREFIX)) continue;
        if (!Identifiers.isSafe(name)) {
          log.warn("classql.schema skipping table with unsafe name={}", name);
          continue;
        }
        names.add(name);
      }
    }
    names.sort(null);
    return names;
  }

  private static List<ColumnInfo> columns(DatabaseMetaData md, String table) throws SQLException {
    List<ColumnInfo> cols = new ArrayList<>();
    // the table argument is a LIKE pattern: '_' in a name matches any character
    try (ResultSet rs = md.getColumns(null, null, table, "%")) {
      while (rs.next()) {
        if (!table.equals(rs.getString("TABLE_NAME"))) continue;
        cols.add(new ColumnInfo(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
      }
    }
    return cols;
  }

  private static long rowCount(Connection c, String table) throws SQLException {
    try (Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + Identifiers.require(table))) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  private List<ResultRow> sample(String table, int sampleRows) {
    if (sampleRows <= 0) return List.of();
    QueryDescription q = new QueryDescription(table, List.of(), List.of(), (long) sampleRows, null, List.of());
    return executor.execute(QueryCompiler.compile(q)).rows();
  }
}
