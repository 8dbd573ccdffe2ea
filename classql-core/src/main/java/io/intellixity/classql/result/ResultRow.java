package io.intellixity.classql.result;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One fetched row: column name to a scalar value ({@link Boolean}, {@link Number}, {@link String}) or null.
 *
 * Columns iterate in lexicographic order regardless of the order the store returned them in.
 */
public final class ResultRow {
  private final SortedMap<String, Object> values;

  private ResultRow(SortedMap<String, Object> values) {
    this.values = Collections.unmodifiableSortedMap(values);
  }

  public static ResultRow of(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    return new ResultRow(new TreeMap<>(values));
  }

  public static Builder builder() { return new Builder(); }

  /** Value for {@code column}, or null when the column is absent or SQL NULL. */
  public Object get(String column) { return values.get(column); }

  public boolean has(String column) { return values.containsKey(column); }

  public List<String> columns() { return List.copyOf(values.keySet()); }

  public int size() { return values.size(); }

  @JsonValue
  public Map<String, Object> asMap() { return values; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResultRow other)) return false;
    return values.equals(other.values);
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  @Override
  public String toString() { return "ResultRow" + values; }

  public static final class Builder {
    private final SortedMap<String, Object> values = new TreeMap<>();

    private Builder() {}

    public Builder put(String column, Object value) {
      values.put(Objects.requireNonNull(column, "column"), value);
      return this;
    }

    public ResultRow build() { return new ResultRow(new TreeMap<>(values)); }
  }
}
