package com.rackspace.timecharts.app.utils;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Arithmetic over mixed {@link Number} types. Integral operands produce a {@link Long}, any
 * floating point operand produces a {@link Double}, and everything else is computed exactly as
 * a {@link BigDecimal}.
 */
public class NumberUtils {

  public static Number add(Number lhs, Number rhs) {
    if (isIntegral(lhs) && isIntegral(rhs)) {
      return Math.addExact(lhs.longValue(), rhs.longValue());
    } else if (isFloating(lhs) || isFloating(rhs)) {
      return lhs.doubleValue() + rhs.doubleValue();
    }
    return toBigDecimal(lhs).add(toBigDecimal(rhs));
  }

  public static Number subtract(Number lhs, Number rhs) {
    if (isIntegral(lhs) && isIntegral(rhs)) {
      return Math.subtractExact(lhs.longValue(), rhs.longValue());
    } else if (isFloating(lhs) || isFloating(rhs)) {
      return lhs.doubleValue() - rhs.doubleValue();
    }
    return toBigDecimal(lhs).subtract(toBigDecimal(rhs));
  }

  public static boolean isZero(Number value) {
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).signum() == 0;
    }
    return value.doubleValue() == 0.0;
  }

  /**
   * Parses an integral literal as a {@link Long} and anything else as a {@link BigDecimal}.
   *
   * @throws NumberFormatException when the text is not a number
   */
  public static Number parse(String text) {
    final BigDecimal decimal = new BigDecimal(text.trim());
    if (decimal.scale() <= 0 && decimal.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
        && decimal.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
      return decimal.longValueExact();
    }
    return decimal;
  }

  public static BigDecimal toBigDecimal(Number value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    } else if (isIntegral(value)) {
      return BigDecimal.valueOf(value.longValue());
    }
    return BigDecimal.valueOf(value.doubleValue());
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte;
  }

  private static boolean isFloating(Number value) {
    return value instanceof Double || value instanceof Float;
  }
}
