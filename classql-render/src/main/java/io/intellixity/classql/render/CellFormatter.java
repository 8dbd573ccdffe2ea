package io.intellixity.classql.render;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Turns a row value into escaped display text.
 *
 * null gives "", booleans and numbers their canonical text, strings are escaped,
 * anything else is escaped compact JSON, or its escaped string form when it cannot be serialized.
 */
final class CellFormatter {
  private final RenderJson json;

  CellFormatter(RenderJson json) {
    this.json = json;
  }

  String format(Object value) {
    if (value == null) return "";
    if (value instanceof Boolean b) return b.toString();
    if (value instanceof Number n) return number(n);
    if (value instanceof String s) return Html.escape(s);
    return Html.escape(json.cellText(value));
  }

  static String number(Number n) {
    if (n instanceof BigDecimal bd) return bd.toPlainString();
    if (n instanceof BigInteger || n instanceof Long || n instanceof Integer
        || n instanceof Short || n instanceof Byte) {
      return n.toString();
    }
    double d = n.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
    String s = (n instanceof Float f) ? Float.toString(f) : Double.toString(d);
    if (s.indexOf('E') < 0) return s;
    String plain = new BigDecimal(s).stripTrailingZeros().toPlainString();
    return plain.indexOf('.') < 0 ? plain + ".0" : plain;
  }
}
