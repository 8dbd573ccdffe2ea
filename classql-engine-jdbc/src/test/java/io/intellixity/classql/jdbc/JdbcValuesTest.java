package io.intellixity.classql.jdbc;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Date;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcValuesTest {

  @Test
  void integralNumbersWidenToLong() {
    assertEquals(7L, JdbcValues.normalize(7));
    assertEquals(7L, JdbcValues.normalize((short) 7));
    assertEquals(7L, JdbcValues.normalize((byte) 7));
    assertEquals(7L, JdbcValues.normalize(7L));
  }

  @Test
  void floatingNumbersBecomeDoubleAndNonFiniteBecomesNull() {
    assertEquals(1.5, JdbcValues.normalize(1.5f));
    assertNull(JdbcValues.normalize(Double.NaN));
    assertNull(JdbcValues.normalize(Float.POSITIVE_INFINITY));
  }

  @Test
  void decimalsAndScalarsArePassedThrough() {
    BigDecimal d = new BigDecimal("12.50");
    assertSame(d, JdbcValues.normalize(d));
    assertEquals(Boolean.TRUE, JdbcValues.normalize(true));
    assertEquals("x", JdbcValues.normalize("x"));
    assertNull(JdbcValues.normalize(null));
  }

  @Test
  void blobsBecomeLowercaseHex() {
    assertEquals("0x00ff10", JdbcValues.normalize(new byte[]{0, (byte) 0xFF, 0x10}));
    assertEquals("0x", JdbcValues.hex(new byte[0]));
  }

  @Test
  void otherValuesUseStringForm() {
    assertEquals("2024-01-02", JdbcValues.normalize(Date.valueOf("2024-01-02")));
  }
}
