package io.intellixity.classql.parse;

import io.intellixity.classql.query.JoinDescription;
import io.intellixity.classql.query.JoinType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JoinParamParserTest {
  @Test
  void parsesFullParam() {
    JoinDescription j = JoinParamParser.parse("posts:id-author_id:title, likes:inner").orElseThrow();
    assertEquals("posts", j.table());
    assertEquals("id", j.parentColumn());
    assertEquals("author_id", j.childColumn());
    assertEquals(List.of("title", "likes"), j.columns());
    assertEquals(JoinType.INNER, j.joinType());
  }

  @Test
  void childColumnDefaultsToTableId() {
    JoinDescription j = JoinParamParser.parse("posts:id").orElseThrow();
    assertEquals("id", j.parentColumn());
    assertEquals("posts_id", j.childColumn());
    assertTrue(j.columns().isEmpty());
    assertEquals(JoinType.LEFT, j.joinType());
  }

  @Test
  void requiresAtLeastTwoSegments() {
    assertTrue(JoinParamParser.parse("posts").isEmpty());
    assertTrue(JoinParamParser.parse("").isEmpty());
    assertTrue(JoinParamParser.parse(null).isEmpty());
  }

  @Test
  void dropsEmptySelectEntries() {
    JoinDescription j = JoinParamParser.parse("posts:id-author_id: ,title,,").orElseThrow();
    assertEquals(List.of("title"), j.columns());
  }

  @Test
  void joinTypeMapping() {
    assertEquals(JoinType.RIGHT, JoinParamParser.parse("posts:id::right").orElseThrow().joinType());
    assertEquals(JoinType.LEFT, JoinParamParser.parse("posts:id::left").orElseThrow().joinType());
    assertEquals(JoinType.LEFT, JoinParamParser.parse("posts:id::outer").orElseThrow().joinType());
    assertEquals(JoinType.LEFT, JoinParamParser.parse("posts:id::INNER").orElseThrow().joinType());
  }

  @Test
  void fromPartsMatchesCompactForm() {
    JoinDescription fromParts = JoinParamParser.fromParts("posts", "id-author_id", "title", "left");
    JoinDescription parsed = JoinParamParser.parse("posts:id-author_id:title:left").orElseThrow();
    assertEquals(parsed, fromParts);
  }

  @Test
  void fromPartsWithoutOptionalParts() {
    JoinDescription j = JoinParamParser.fromParts("orders", "id", null, null);
    assertEquals("orders_id", j.childColumn());
    assertTrue(j.columns().isEmpty());
    assertEquals(JoinType.LEFT, j.joinType());
  }
}
