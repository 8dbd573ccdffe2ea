package io.intellixity.classql.compile;

import io.intellixity.classql.query.QueryValidationException;

/** A table or column name that is not a plain SQL identifier. */
public final class InvalidIdentifierException extends QueryValidationException {
  private final String identifier;

  public InvalidIdentifierException(String identifier) {
    super("invalid identifier: " + identifier);
    this.identifier = identifier;
  }

  public String identifier() { return identifier; }
}
