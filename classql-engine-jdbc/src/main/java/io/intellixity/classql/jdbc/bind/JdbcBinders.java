package io.intellixity.classql.jdbc.bind;

import io.intellixity.classql.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered binder chain: the first binder that supports a bind wins.
 *
 * Extra binders passed to {@link #withExtra(Collection)} are evaluated before the base ones.
 */
public final class JdbcBinders {
  private final List<JdbcBinder> binders;

  private JdbcBinders(List<JdbcBinder> binders) {
    this.binders = List.copyOf(binders);
  }

  public static JdbcBinders defaults() {
    return new JdbcBinders(base());
  }

  public static JdbcBinders withExtra(Collection<? extends JdbcBinder> extra) {
    List<JdbcBinder> out = new ArrayList<>(extra);
    out.addAll(base());
    return new JdbcBinders(out);
  }

  public void bindAll(PreparedStatement ps, List<Bind> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      binderFor(b).bind(ps, i + 1, b);
    }
  }

  private JdbcBinder binderFor(Bind b) {
    for (JdbcBinder binder : binders) {
      if (binder.supports(b)) return binder;
    }
    throw new IllegalStateException("No binder for userTypeId=" + b.userTypeId());
  }

  private static List<JdbcBinder> base() {
    return List.of(new StringBinder(), new LongBinder(), new SetObjectBinder());
  }

  static final class StringBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) { return Bind.STRING.equals(bind.userTypeId()); }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      if (bind.value() == null) {
        ps.setNull(pos, Types.VARCHAR);
      } else {
        ps.setString(pos, String.valueOf(bind.value()));
      }
    }
  }

  static final class LongBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) { return Bind.LONG.equals(bind.userTypeId()); }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      if (bind.value() == null) {
        ps.setNull(pos, Types.BIGINT);
      } else if (bind.value() instanceof Number n) {
        ps.setLong(pos, n.longValue());
      } else {
        ps.setLong(pos, Long.parseLong(String.valueOf(bind.value()).trim()));
      }
    }
  }

  static final class SetObjectBinder implements JdbcBinder {
    @Override
    public boolean supports(Bind bind) { return true; }

    @Override
    public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
      ps.setObject(pos, bind.value());
    }
  }
}
