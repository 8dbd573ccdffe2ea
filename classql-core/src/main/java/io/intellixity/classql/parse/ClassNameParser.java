package io.intellixity.classql.parse;

import io.intellixity.classql.query.OrderBy;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.query.WhereClause;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parses hyphen-delimited class names into a {@link QueryDescription}.
 *
 * Grammar:
 * <pre>
 * db-&lt;table&gt;(-&lt;col&gt;)*(-where-&lt;field&gt;-&lt;value&gt;(-&lt;field&gt;-&lt;value&gt;)*)?(-limit-&lt;n&gt;)?(-orderby-&lt;field&gt;(-asc|-desc)?)?
 * </pre>
 *
 * The {@code where}, {@code limit} and {@code orderby} segments may appear in any order and may recur;
 * each one resets the clause state. Parsing is total: anything unrecognized yields an empty result.
 */
public final class ClassNameParser {
  public static final String PREFIX = "db-";

  static final String WHERE = "where";
  static final String LIMIT = "limit";
  static final String ORDER_BY = "orderby";

  private ClassNameParser() {}

  public static Optional<QueryDescription> parseSingle(String className) {
    if (className == null || !className.startsWith(PREFIX)) return Optional.empty();

    String body = className.trim().substring(PREFIX.length());
    List<String> tokens = Arrays.asList(body.split("-", -1));
    if (tokens.isEmpty() || tokens.get(0).isEmpty()) return Optional.empty();

    ParseState state = ParseState.start(tokens.get(0));
    for (String token : tokens.subList(1, tokens.size())) {
      state = state.accept(token);
    }
    return Optional.of(state.toDescription());
  }

  /** Tries each whitespace-separated token in order; the first that parses wins. */
  public static Optional<QueryDescription> parseAny(String classAttribute) {
    if (classAttribute == null) return Optional.empty();
    return Arrays.stream(classAttribute.trim().split("\\s+"))
        .filter(t -> !t.isEmpty())
        .map(ClassNameParser::parseSingle)
        .flatMap(Optional::stream)
        .findFirst();
  }

  enum Mode { COLUMN, WHERE_FIELD, WHERE_VALUE, LIMIT, ORDER_BY_FIELD, ORDER_BY_DIR }

  /** Immutable fold state; every transition returns a new instance. */
  record ParseState(Mode mode,
                    String pendingField,
                    String table,
                    List<String> columns,
                    List<WhereClause> where,
                    Long limit,
                    OrderBy orderBy) {

    static ParseState start(String table) {
      return new ParseState(Mode.COLUMN, null, table, List.of(), List.of(), null, null);
    }

    ParseState accept(String token) {
      switch (token) {
        case WHERE:
          return withMode(Mode.WHERE_FIELD);
        case LIMIT:
          return withMode(Mode.LIMIT);
        case ORDER_BY:
          return withMode(Mode.ORDER_BY_FIELD);
        default:
          break;
      }

      return switch (mode) {
        case COLUMN -> new ParseState(mode, pendingField, table, append(columns, token), where, limit, orderBy);
        case WHERE_FIELD -> new ParseState(Mode.WHERE_VALUE, token, table, columns, where, limit, orderBy);
        case WHERE_VALUE -> new ParseState(Mode.WHERE_FIELD, pendingField, table, columns,
            append(where, new WhereClause(pendingField, token)), limit, orderBy);
        case LIMIT -> new ParseState(Mode.COLUMN, pendingField, table, columns, where, parseLimit(token), orderBy);
        case ORDER_BY_FIELD -> new ParseState(Mode.ORDER_BY_DIR, pendingField, table, columns, where, limit,
            new OrderBy(token, OrderBy.Direction.ASC));
        case ORDER_BY_DIR -> new ParseState(Mode.COLUMN, pendingField, table, columns, where, limit,
            applyDirection(orderBy, token));
      };
    }

    QueryDescription toDescription() {
      return new QueryDescription(table, columns, where, limit, orderBy, List.of());
    }

    private ParseState withMode(Mode next) {
      return new ParseState(next, pendingField, table, columns, where, limit, orderBy);
    }

    // An unparseable limit keeps whatever was there before.
    private Long parseLimit(String token) {
      try {
        return Long.parseLong(token);
      } catch (NumberFormatException e) {
        return limit;
      }
    }

    private static OrderBy applyDirection(OrderBy current, String token) {
      if (current == null) return null;
      if ("asc".equals(token)) return current.withDirection(OrderBy.Direction.ASC);
      if ("desc".equals(token)) return current.withDirection(OrderBy.Direction.DESC);
      return current;
    }

    private static <T> List<T> append(List<T> list, T item) {
      List<T> out = new ArrayList<>(list.size() + 1);
      out.addAll(list);
      out.add(item);
      return List.copyOf(out);
    }
  }
}
