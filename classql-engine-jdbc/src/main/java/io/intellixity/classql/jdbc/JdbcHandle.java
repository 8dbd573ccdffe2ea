package io.intellixity.classql.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC store handle resolved by application code; pooling belongs to the {@link DataSource}. */
public final class JdbcHandle {
  private final String id;
  private final DataSource client;

  public JdbcHandle(String id, DataSource client) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
  }

  public String id() { return id; }
  public DataSource client() { return client; }
}
