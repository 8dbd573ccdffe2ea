package io.intellixity.classql.parse;

import io.intellixity.classql.query.JoinDescription;
import io.intellixity.classql.query.JoinType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the compact join parameter {@code table:parent[-child][:col1,col2][:inner|left|right]}.
 *
 * A missing child column defaults to {@code <table>_id}; a missing or unknown join type is LEFT.
 */
public final class JoinParamParser {
  private JoinParamParser() {}

  public static Optional<JoinDescription> parse(String param) {
    if (param == null) return Optional.empty();
    String[] parts = param.split(":", -1);
    if (parts.length < 2) return Optional.empty();

    String select = parts.length > 2 ? parts[2] : null;
    String joinType = parts.length > 3 ? parts[3] : null;
    return Optional.of(fromParts(parts[0], parts[1], select, joinType));
  }

  /** Builds a join from already separated components; {@code select} and {@code joinType} may be null. */
  public static JoinDescription fromParts(String table, String on, String select, String joinType) {
    String[] onParts = (on == null ? "" : on).split("-", -1);
    String parent = onParts[0];
    String child = onParts.length > 1 ? onParts[1] : table + "_id";
    return new JoinDescription(table, parent, child, splitColumns(select), JoinType.fromToken(joinType));
  }

  private static List<String> splitColumns(String select) {
    if (select == null || select.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : select.split(",")) {
      String col = part.trim();
      if (!col.isEmpty()) out.add(col);
    }
    return out;
  }
}
