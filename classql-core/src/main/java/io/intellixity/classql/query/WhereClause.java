package io.intellixity.classql.query;

import java.util.Objects;

/** Equality filter {@code field = value}; the value is always carried as text. */
public record WhereClause(String field, String value) {
  public WhereClause {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
  }
}
