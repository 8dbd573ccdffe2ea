package io.intellixity.classql.jdbc.schema;

import java.util.Objects;

/** Column name and declared type as reported by the driver. */
public record ColumnInfo(String name, String type) {
  public ColumnInfo {
    Objects.requireNonNull(name, "name");
    type = (type == null || type.isBlank()) ? "TEXT" : type;
  }
}
