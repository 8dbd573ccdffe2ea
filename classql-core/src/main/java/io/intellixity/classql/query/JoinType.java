package io.intellixity.classql.query;

public enum JoinType {
  INNER("INNER"),
  LEFT("LEFT"),
  RIGHT("RIGHT");

  private final String sql;

  JoinType(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }

  /** {@code inner} and {@code right} map exactly; anything else (including null) is LEFT. */
  public static JoinType fromToken(String token) {
    if ("inner".equals(token)) return INNER;
    if ("right".equals(token)) return RIGHT;
    return LEFT;
  }
}
