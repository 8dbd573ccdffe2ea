package io.intellixity.classql.examples.web;

import io.intellixity.classql.examples.service.QueryService;
import io.intellixity.classql.jdbc.QueryOutput;
import io.intellixity.classql.result.ResultRow;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api")
public final class QueryController {
  private final QueryService queries;

  public QueryController(QueryService queries) {
    this.queries = queries;
  }

  public record QueryResponse(boolean success, String query, List<Object> params, List<ResultRow> results, int count) {
    static QueryResponse of(QueryOutput out) {
      return new QueryResponse(true, out.sql(), out.params(), out.rows(), out.count());
    }
  }

  @GetMapping(value = "/query", produces = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse query(@RequestParam(value = "className", required = false) String className,
                             @RequestParam(value = "join", required = false) String join) {
    return QueryResponse.of(queries.query(className, join));
  }

  @GetMapping("/render")
  public ResponseEntity<String> render(@RequestParam(value = "className", required = false) String className,
                                       @RequestParam(value = "join", required = false) String join,
                                       @RequestParam(value = "as", required = false) String as) {
    return ResponseEntity.ok()
        .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
        .body(queries.render(className, join, as));
  }
}
