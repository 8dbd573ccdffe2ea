package io.intellixity.classql.jdbc;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Normalizes raw {@code ResultSet.getObject} values into row scalars.
 *
 * Integral numbers become {@link Long}, floating numbers {@link Double} (non-finite becomes null),
 * blobs become {@code 0x}-prefixed lowercase hex, other non-scalar values their string form.
 */
public final class JdbcValues {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private JdbcValues() {}

  public static Object normalize(Object raw) {
    if (raw == null) return null;
    if (raw instanceof String || raw instanceof Boolean || raw instanceof Long) return raw;
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) return ((Number) raw).longValue();
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      return (Double.isNaN(d) || Double.isInfinite(d)) ? null : d;
    }
    if (raw instanceof BigDecimal || raw instanceof BigInteger) return raw;
    if (raw instanceof byte[] bytes) return hex(bytes);
    return String.valueOf(raw);
  }

  static String hex(byte[] bytes) {
    StringBuilder sb = new StringBuilder(2 + bytes.length * 2).append("0x");
    for (byte b : bytes) {
      sb.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
    }
    return sb.toString();
  }
}
