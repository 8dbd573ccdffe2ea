package io.intellixity.classql.query;

import io.intellixity.classql.parse.ClassNameParser;
import io.intellixity.classql.parse.JoinParamParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryDescriptionTest {
  @Test
  void withJoinAppendsWithoutTouchingOriginal() {
    QueryDescription base = ClassNameParser.parseSingle("db-users-name").orElseThrow();
    JoinDescription posts = JoinParamParser.parse("posts:id-author_id").orElseThrow();
    JoinDescription teams = JoinParamParser.parse("teams:team_id-id").orElseThrow();

    QueryDescription one = base.withJoin(posts);
    QueryDescription two = one.withJoin(teams);

    assertTrue(base.joins().isEmpty());
    assertEquals(List.of(posts), one.joins());
    assertEquals(List.of(posts, teams), two.joins());
    assertEquals(base.columns(), two.columns());
  }

  @Test
  void listsAreCopied() {
    List<String> cols = new ArrayList<>(List.of("a"));
    QueryDescription q = new QueryDescription("t", cols, null, null, null, null);
    cols.add("b");
    assertEquals(List.of("a"), q.columns());
    assertThrows(UnsupportedOperationException.class, () -> q.columns().add("c"));
    assertTrue(q.where().isEmpty());
    assertTrue(q.joins().isEmpty());
  }

  @Test
  void whereAsMapKeepsLastValue() {
    QueryDescription q = ClassNameParser.parseSingle("db-t-where-a-1-b-2-a-3").orElseThrow();
    Map<String, String> m = q.whereAsMap();
    assertEquals(Map.of("a", "3", "b", "2"), m);
    assertEquals(List.of("a", "b"), new ArrayList<>(m.keySet()));
  }

  @Test
  void orderByDirectionDefaultsToAscending() {
    assertEquals(OrderBy.Direction.ASC, new OrderBy("x", null).direction());
  }
}
