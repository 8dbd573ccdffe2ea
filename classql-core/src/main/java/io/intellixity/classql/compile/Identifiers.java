package io.intellixity.classql.compile;

/**
 * Gate for every table and column name that reaches generated SQL.
 *
 * A safe identifier starts with an ASCII letter or underscore, followed by ASCII letters, digits or underscores.
 */
public final class Identifiers {
  private Identifiers() {}

  public static boolean isSafe(String name) {
    if (name == null || name.isEmpty()) return false;
    if (!isIdentStart(name.charAt(0))) return false;
    for (int i = 1; i < name.length(); i++) {
      if (!isIdentPart(name.charAt(i))) return false;
    }
    return true;
  }

  /** Returns {@code name} unchanged, or throws {@link InvalidIdentifierException}. */
  public static String require(String name) {
    if (!isSafe(name)) throw new InvalidIdentifierException(name);
    return name;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
