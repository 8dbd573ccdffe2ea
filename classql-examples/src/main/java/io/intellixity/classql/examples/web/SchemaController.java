package io.intellixity.classql.examples.web;

import io.intellixity.classql.examples.config.ClassqlProperties;
import io.intellixity.classql.jdbc.schema.SchemaInspector;
import io.intellixity.classql.jdbc.schema.TableInfo;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/schema")
public final class SchemaController {
  private final SchemaInspector inspector;
  private final ClassqlProperties props;

  public SchemaController(SchemaInspector inspector, ClassqlProperties props) {
    this.inspector = inspector;
    this.props = props;
  }

  public record SchemaResponse(List<TableInfo> tables) {}

  @GetMapping
  public SchemaResponse schema() {
    return new SchemaResponse(inspector.describe(props.getSchema().getSampleRows()));
  }
}
