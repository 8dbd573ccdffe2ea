package io.intellixity.classql.jdbc;

/** The store failed to execute a compiled statement. */
public final class QueryExecutionException extends RuntimeException {
  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
