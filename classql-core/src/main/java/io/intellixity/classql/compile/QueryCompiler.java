package io.intellixity.classql.compile;

import io.intellixity.classql.query.JoinDescription;
import io.intellixity.classql.query.OrderBy;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.query.WhereClause;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link QueryDescription} into a single parameterized SELECT.
 *
 * Clause order is fixed: projection, FROM, joins, WHERE, ORDER BY, LIMIT.
 * Identifiers are validated before any SQL is assembled; the first invalid one aborts with
 * {@link InvalidIdentifierException}. With joins present every column reference is qualified with its table.
 */
public final class QueryCompiler {
  private QueryCompiler() {}

  public static CompiledQuery compile(QueryDescription q) {
    Objects.requireNonNull(q, "query");

    String table = Identifiers.require(q.table());
    boolean qualify = q.hasJoins();

    List<String> select = new ArrayList<>();
    if (!q.columns().isEmpty()) {
      for (String column : q.columns()) {
        select.add(ref(table, Identifiers.require(column), qualify));
      }
    } else {
      select.add(qualify ? table + ".*" : "*");
    }

    for (JoinDescription j : q.joins()) {
      String joinTable = Identifiers.require(j.table());
      if (j.columns().isEmpty()) {
        select.add(joinTable + ".*");
      } else {
        for (String column : j.columns()) {
          select.add(joinTable + "." + Identifiers.require(column));
        }
      }
    }

    List<String> conditions = new ArrayList<>();
    List<Bind> binds = new ArrayList<>();
    for (WhereClause w : q.where()) {
      conditions.add(ref(table, Identifiers.require(w.field()), qualify) + " = ?");
      binds.add(Bind.text(w.value()));
    }

    String orderSql = null;
    OrderBy orderBy = q.orderBy();
    if (orderBy != null) {
      orderSql = ref(table, Identifiers.require(orderBy.field()), qualify) + " " + orderBy.direction().sql();
    }

    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", select))
        .append(" FROM ").append(table);

    for (JoinDescription j : q.joins()) {
      String joinTable = Identifiers.require(j.table());
      String parent = Identifiers.require(j.parentColumn());
      String child = Identifiers.require(j.childColumn());
      sql.append(' ').append(j.joinType().sql()).append(" JOIN ").append(joinTable)
          .append(" ON ").append(table).append('.').append(parent)
          .append(" = ").append(joinTable).append('.').append(child);
    }

    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    if (orderSql != null) {
      sql.append(" ORDER BY ").append(orderSql);
    }
    if (q.limit() != null) {
      sql.append(" LIMIT ?");
      binds.add(Bind.integer(q.limit()));
    }

    return new CompiledQuery(sql.toString(), binds);
  }

  private static String ref(String table, String column, boolean qualify) {
    return qualify ? table + "." + column : column;
  }
}
