package io.intellixity.classql.examples.service;

import io.intellixity.classql.jdbc.QueryOutput;
import io.intellixity.classql.parse.ClassNameParser;
import io.intellixity.classql.parse.JoinParamParser;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.render.DisplayMode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/** Showcase queries rendered against the live store. */
@Service
public final class ExampleCatalog {
  static final String HERO_CLASS_NAME = "db-users-name-where-id-1";

  private final QueryService queries;

  public ExampleCatalog(QueryService queries) {
    this.queries = queries;
  }

  public record Example(String title, String description, String className, String join, DisplayMode mode) {
    public String as() { return mode.label(); }
  }

  public record Card(String title, String description, String className, String join, String as, String outputHtml) {}

  public record Showcase(String hero, List<Card> examples) {}

  public static List<Example> examples() {
    return List.of(
        new Example("Get User Name", "Fetch a single user's name by ID",
            HERO_CLASS_NAME, null, DisplayMode.SPAN),
        new Example("Product List", "Display products as an unordered list",
            "db-products-title-limit-5", null, DisplayMode.UL),
        new Example("Top Posts by Likes", "Posts ordered by popularity",
            "db-posts-title-orderby-likes-desc-limit-3", null, DisplayMode.OL),
        new Example("Users with Posts (JOIN)", "Join users with their posts",
            "db-users-name-limit-5", "posts:id-author_id:title:left", DisplayMode.TABLE));
  }

  public Showcase showcase() {
    QueryOutput hero = queries.run(parse(HERO_CLASS_NAME, null));
    List<Card> cards = new ArrayList<>();
    for (Example e : examples()) {
      QueryOutput out = queries.run(parse(e.className(), e.join()));
      cards.add(new Card(e.title(), e.description(), e.className(), e.join(), e.as(), queries.render(out, e.mode())));
    }
    return new Showcase(queries.renderText(hero, DisplayMode.SPAN), cards);
  }

  private static QueryDescription parse(String className, String join) {
    QueryDescription q = ClassNameParser.parseSingle(className)
        .orElseThrow(() -> new IllegalStateException("Bad example class name: " + className));
    if (join == null) return q;
    return q.withJoin(JoinParamParser.parse(join)
        .orElseThrow(() -> new IllegalStateException("Bad example join: " + join)));
  }
}
