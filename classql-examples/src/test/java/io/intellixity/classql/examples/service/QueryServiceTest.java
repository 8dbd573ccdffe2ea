package io.intellixity.classql.examples.service;

import io.intellixity.classql.examples.DemoStore;
import io.intellixity.classql.jdbc.QueryOutput;
import io.intellixity.classql.query.JoinType;
import io.intellixity.classql.query.QueryDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryServiceTest {
  @TempDir
  Path dir;

  private QueryService service;

  @BeforeEach
  void setUp() {
    service = DemoStore.queryService(dir);
  }

  @Test
  void missingClassNameIsRejected() {
    InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> service.describe(null, null));
    assertEquals("Missing className parameter", e.getMessage());
  }

  @Test
  void blankClassNameIsInvalidRatherThanMissing() {
    InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> service.describe("", null));
    assertEquals("Invalid class name: ", e.getMessage());

    e = assertThrows(InvalidRequestException.class, () -> service.describe("  ", null));
    assertEquals("Invalid class name:   ", e.getMessage());
  }

  @Test
  void classAttributeWithoutQueryTokenIsRejected() {
    InvalidRequestException e = assertThrows(InvalidRequestException.class,
        () -> service.describe("text-lg font-bold", null));
    assertEquals("Invalid class name: text-lg font-bold", e.getMessage());
  }

  @Test
  void firstQueryTokenOfClassAttributeWins() {
    QueryDescription q = service.describe("p-4 db-users-name db-posts-title", null);

    assertEquals("users", q.table());
    assertEquals(List.of("name"), q.columns());
  }

  @Test
  void joinParameterIsAttachedWhenParseable() {
    QueryDescription q = service.describe("db-users-name", "posts:id-author_id:title:inner");

    assertEquals(1, q.joins().size());
    assertEquals(JoinType.INNER, q.joins().get(0).joinType());
  }

  @Test
  void unparseableJoinIsIgnored() {
    QueryDescription q = service.describe("db-users-name", "posts");

    assertFalse(q.hasJoins());
  }

  @Test
  void queryRunsAgainstStore() {
    QueryOutput out = service.query("db-users-name-where-id-1", null);

    assertEquals("SELECT name FROM users WHERE id = ?", out.sql());
    assertEquals(List.of("1"), out.params());
    assertEquals(1, out.count());
  }

  @Test
  void renderUsesRequestedMode() {
    String html = service.render("db-products-title-limit-3", null, "ol");

    assertTrue(html.startsWith("<ol"), html);
    assertEquals(3, html.split("<li>", -1).length - 1);
  }

  @Test
  void renderFallsBackToSpanForUnknownMode() {
    assertEquals("<span>Ada Lovelace</span>", service.render("db-users-name-where-id-1", null, "marquee"));
  }
}
