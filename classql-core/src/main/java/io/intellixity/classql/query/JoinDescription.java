package io.intellixity.classql.query;

import java.util.List;
import java.util.Objects;

/**
 * One additional table joined onto the primary table.
 *
 * @param table joined table name
 * @param parentColumn column on the primary table
 * @param childColumn column on the joined table
 * @param columns selected columns of the joined table; empty selects {@code table.*}
 * @param joinType join flavour
 */
public record JoinDescription(String table,
                              String parentColumn,
                              String childColumn,
                              List<String> columns,
                              JoinType joinType) {
  public JoinDescription {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(parentColumn, "parentColumn");
    Objects.requireNonNull(childColumn, "childColumn");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    joinType = (joinType == null) ? JoinType.LEFT : joinType;
  }
}
