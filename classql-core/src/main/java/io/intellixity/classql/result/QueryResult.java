package io.intellixity.classql.result;

import java.util.List;

/**
 * Rows returned by the store.
 *
 * @param columns column labels in the order the store reported them
 * @param rows fetched rows
 */
public record QueryResult(List<String> columns, List<ResultRow> rows) {
  public QueryResult {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public boolean isEmpty() { return rows.isEmpty(); }
}
