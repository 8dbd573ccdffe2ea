package io.intellixity.classql.examples.service;

/** Request parameters that cannot be turned into a query; mapped to HTTP 400. */
public class InvalidRequestException extends RuntimeException {
  public InvalidRequestException(String message) {
    super(message);
  }
}
