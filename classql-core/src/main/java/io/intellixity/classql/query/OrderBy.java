package io.intellixity.classql.query;

import java.util.Objects;

public record OrderBy(String field, Direction direction) {
  public OrderBy {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public OrderBy withDirection(Direction direction) {
    return new OrderBy(field, direction);
  }

  public enum Direction {
    ASC, DESC;

    public String sql() { return name(); }
  }
}
