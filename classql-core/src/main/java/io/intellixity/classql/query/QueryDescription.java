package io.intellixity.classql.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured form of a class-name query.
 * <p>
 * Instances are immutable; {@link #withJoin(JoinDescription)} returns a copy.
 *
 * @param table primary table
 * @param columns selected columns, empty means all columns
 * @param where AND-combined equality filters in declaration order
 * @param limit row limit, or null
 * @param orderBy ordering, or null
 * @param joins joined tables in declaration order
 */
public record QueryDescription(String table,
                               List<String> columns,
                               List<WhereClause> where,
                               Long limit,
                               OrderBy orderBy,
                               List<JoinDescription> joins) {
  public QueryDescription {
    Objects.requireNonNull(table, "table");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    where = (where == null) ? List.of() : List.copyOf(where);
    joins = (joins == null) ? List.of() : List.copyOf(joins);
  }

  public static QueryDescription of(String table) {
    return new QueryDescription(table, List.of(), List.of(), null, null, List.of());
  }

  public boolean hasJoins() { return !joins.isEmpty(); }

  public QueryDescription withJoin(JoinDescription join) {
    Objects.requireNonNull(join, "join");
    List<JoinDescription> next = new ArrayList<>(joins.size() + 1);
    next.addAll(joins);
    next.add(join);
    return new QueryDescription(table, columns, where, limit, orderBy, next);
  }

  /** Where filters keyed by field; a repeated field keeps its last value. */
  public Map<String, String> whereAsMap() {
    Map<String, String> out = new LinkedHashMap<>();
    for (WhereClause w : where) out.put(w.field(), w.value());
    return Collections.unmodifiableMap(out);
  }
}
