package io.intellixity.classql.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Parameterized SQL with {@code ?} placeholders and the binds in placeholder order. */
public record CompiledQuery(String sql, List<Bind> binds) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }

  /** Bound values without type information. */
  public List<Object> params() {
    List<Object> out = new ArrayList<>(binds.size());
    for (Bind b : binds) out.add(b.value());
    return out;
  }
}
