package io.intellixity.classql.jdbc;

import io.intellixity.classql.compile.InvalidIdentifierException;
import io.intellixity.classql.parse.ClassNameParser;
import io.intellixity.classql.parse.JoinParamParser;
import io.intellixity.classql.query.QueryDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryRunnerTest {
  @TempDir
  Path dir;

  private QueryRunner runner;

  @BeforeEach
  void setUp() throws SQLException {
    runner = new QueryRunner(new JdbcQueryExecutor(SqliteFixture.handle(dir)));
  }

  private static QueryDescription parse(String className) {
    return ClassNameParser.parseSingle(className).orElseThrow();
  }

  @Test
  void runsWhereQueryWithStringBinds() {
    QueryOutput out = runner.run(parse("db-users-name-where-id-1"));

    assertEquals("SELECT name FROM users WHERE id = ?", out.sql());
    assertEquals(List.of("1"), out.params());
    assertEquals(1, out.count());
    assertEquals("Ada", out.rows().get(0).get("name"));
    assertEquals(List.of("name"), out.displayColumns());
  }

  @Test
  void ordersAndLimits() {
    QueryOutput out = runner.run(parse("db-posts-title-orderby-likes-desc-limit-2"));

    assertEquals(List.of(2L), out.params());
    assertEquals(2, out.count());
    assertEquals("Kernels", out.rows().get(0).get("title"));
    assertEquals("Engines", out.rows().get(1).get("title"));
  }

  @Test
  void joinAppendsJoinColumnsToDisplayColumns() {
    QueryDescription q = parse("db-users-name-where-id-1")
        .withJoin(JoinParamParser.fromParts("posts", "id-author_id", "title", "inner"));

    QueryOutput out = runner.run(q);

    assertEquals("SELECT users.name, posts.title FROM users INNER JOIN posts ON users.id = posts.author_id"
        + " WHERE users.id = ?", out.sql());
    assertEquals(List.of("name", "title"), out.displayColumns());
    assertEquals(2, out.count());
    assertEquals("Ada", out.rows().get(0).get("name"));
  }

  @Test
  void noRequestedColumnsFallsBackToStoreColumns() {
    QueryOutput out = runner.run(parse("db-products-limit-1"));

    assertEquals(List.of("id", "title", "price", "image"), out.displayColumns());
    assertEquals(1, out.count());
  }

  @Test
  void unsafeIdentifierFailsBeforeTouchingTheStore() {
    QueryDescription q = new QueryDescription("users", List.of("name;drop"), List.of(), null, null, List.of());

    InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class, () -> runner.run(q));
    assertEquals("name;drop", e.identifier());
  }

  @Test
  void unknownTableSurfacesAsExecutionFailure() {
    assertThrows(QueryExecutionException.class, () -> runner.run(parse("db-ghosts-name")));
  }
}
