package io.intellixity.classql.jdbc.bind;

import io.intellixity.classql.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Writes one {@link Bind} into a prepared statement slot. */
public interface JdbcBinder {
  boolean supports(Bind bind);

  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
