package io.intellixity.classql.examples.web;

import io.intellixity.classql.compile.InvalidIdentifierException;
import io.intellixity.classql.examples.DemoStore;
import io.intellixity.classql.examples.service.InvalidRequestException;
import io.intellixity.classql.jdbc.QueryExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ApiExceptionHandlerTest {
  @TempDir
  Path dir;

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void invalidRequestIsBadRequest() {
    ResponseEntity<ApiExceptionHandler.ErrorResponse> r =
        handler.badRequest(new InvalidRequestException("Missing className parameter"));

    assertEquals(400, r.getStatusCode().value());
    assertEquals("Missing className parameter", r.getBody().error());
  }

  @Test
  void invalidIdentifierIsServerError() {
    QueryController controller = new QueryController(DemoStore.queryService(dir));
    InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
        () -> controller.query("db-users-name;drop", null));

    ResponseEntity<ApiExceptionHandler.ErrorResponse> r = handler.queryFailed(e);
    assertEquals(500, r.getStatusCode().value());
    assertEquals("invalid identifier: name;drop", r.getBody().error());
  }

  @Test
  void storeFailureIsServerError() {
    QueryController controller = new QueryController(DemoStore.queryService(dir));
    QueryExecutionException e = assertThrows(QueryExecutionException.class,
        () -> controller.query("db-ghosts-name", null));

    ResponseEntity<ApiExceptionHandler.ErrorResponse> r = handler.queryFailed(e);
    assertEquals(500, r.getStatusCode().value());
    assertTrue(r.getBody().error().startsWith("Failed to execute query"));
  }
}
