package io.intellixity.classql.examples.service;

import io.intellixity.classql.jdbc.QueryOutput;
import io.intellixity.classql.jdbc.QueryRunner;
import io.intellixity.classql.parse.ClassNameParser;
import io.intellixity.classql.parse.JoinParamParser;
import io.intellixity.classql.query.JoinDescription;
import io.intellixity.classql.query.QueryDescription;
import io.intellixity.classql.render.DisplayMode;
import io.intellixity.classql.render.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public final class QueryService {
  private static final Logger log = LoggerFactory.getLogger(QueryService.class);

  private final QueryRunner runner;
  private final ResultRenderer renderer;

  public QueryService(QueryRunner runner, ResultRenderer renderer) {
    this.runner = runner;
    this.renderer = renderer;
  }

  /**
   * Parses the class attribute and attaches the optional join.
   * Only an absent class name counts as missing; a blank one is invalid.
   * An unparseable join parameter is ignored.
   */
  public QueryDescription describe(String className, String join) {
    if (className == null) {
      throw new InvalidRequestException("Missing className parameter");
    }
    QueryDescription q = ClassNameParser.parseAny(className)
        .orElseThrow(() -> new InvalidRequestException("Invalid class name: " + className));

    if (join != null) {
      Optional<JoinDescription> j = JoinParamParser.parse(join);
      if (j.isPresent()) {
        q = q.withJoin(j.get());
      } else {
        log.debug("classql.query ignoring unparseable join={}", join);
      }
    }
    return q;
  }

  public QueryOutput query(String className, String join) {
    return runner.run(describe(className, join));
  }

  public QueryOutput run(QueryDescription query) {
    return runner.run(query);
  }

  public String render(String className, String join, String as) {
    return render(query(className, join), DisplayMode.parse(as));
  }

  public String render(QueryOutput out, DisplayMode mode) {
    return renderer.render(out.rows(), out.displayColumns(), mode);
  }

  public String renderText(QueryOutput out, DisplayMode mode) {
    return renderer.renderText(out.rows(), out.displayColumns(), mode);
  }
}
