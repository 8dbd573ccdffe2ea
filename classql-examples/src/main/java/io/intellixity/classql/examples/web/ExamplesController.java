package io.intellixity.classql.examples.web;

import io.intellixity.classql.examples.service.ExampleCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/examples")
public final class ExamplesController {
  private final ExampleCatalog catalog;

  public ExamplesController(ExampleCatalog catalog) {
    this.catalog = catalog;
  }

  @GetMapping
  public ExampleCatalog.Showcase examples() {
    return catalog.showcase();
  }
}
