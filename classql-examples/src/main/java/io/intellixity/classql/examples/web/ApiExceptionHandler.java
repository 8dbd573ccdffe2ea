package io.intellixity.classql.examples.web;

import io.intellixity.classql.examples.service.InvalidRequestException;
import io.intellixity.classql.jdbc.QueryExecutionException;
import io.intellixity.classql.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps query failures to {@code {"error": message}} bodies. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ErrorResponse(String error) {}

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> badRequest(InvalidRequestException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  // invalid identifiers surface as server errors, like store failures
  @ExceptionHandler({QueryValidationException.class, QueryExecutionException.class})
  public ResponseEntity<ErrorResponse> queryFailed(RuntimeException e) {
    log.error("classql.query_failed error={}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ErrorResponse(message));
  }
}
