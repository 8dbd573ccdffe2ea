package io.intellixity.classql.query;

/**
 * Raised when a query description cannot be turned into a safe statement.
 * <p>
 * Parsing never throws; validation failures surface at compile time.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
