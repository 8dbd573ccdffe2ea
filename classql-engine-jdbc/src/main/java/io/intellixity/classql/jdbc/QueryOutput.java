package io.intellixity.classql.jdbc;

import io.intellixity.classql.result.ResultRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of running one class-name query.
 *
 * @param sql executed statement
 * @param params bound values in placeholder order
 * @param rows fetched rows
 * @param displayColumns columns to render, in order
 */
public record QueryOutput(String sql, List<Object> params, List<ResultRow> rows, List<String> displayColumns) {
  public QueryOutput {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    rows = rows == null ? List.of() : List.copyOf(rows);
    displayColumns = displayColumns == null ? List.of() : List.copyOf(displayColumns);
  }

  public int count() { return rows.size(); }
}
