package io.intellixity.classql.compile;

/**
 * A positional bind value together with the user type used to encode it.
 *
 * @param value raw value
 * @param userTypeId {@code "string"} or {@code "long"}
 */
public record Bind(Object value, String userTypeId) {
  public static final String STRING = "string";
  public static final String LONG = "long";

  public static Bind text(String value) { return new Bind(value, STRING); }
  public static Bind integer(long value) { return new Bind(value, LONG); }
}
