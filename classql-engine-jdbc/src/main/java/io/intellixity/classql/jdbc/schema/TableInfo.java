package io.intellixity.classql.jdbc.schema;

import io.intellixity.classql.result.ResultRow;

import java.util.List;
import java.util.Objects;

/**
 * One table of the store with its columns, row count and a sample of rows.
 *
 * @param data the first rows of the table, at most the requested sample size
 */
public record TableInfo(String name, List<ColumnInfo> columns, long rowCount, List<ResultRow> data) {
  public TableInfo {
    Objects.requireNonNull(name, "name");
    columns = columns == null ? List.of() : List.copyOf(columns);
    data = data == null ? List.of() : List.copyOf(data);
  }
}
