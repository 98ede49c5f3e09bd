package com.gentoro.annomics.utility;

import java.math.BigDecimal;
import java.util.OptionalInt;
import org.apache.commons.lang3.math.NumberUtils;

/** Narrowing of loosely-typed JSON numbers. */
public final class NumberUtility {

  private NumberUtility() {}

  /**
   * The value as an {@code int} when it is a whole number (or a string of digits) that fits the
   * {@code int} range; empty otherwise. Values are never truncated.
   */
  public static OptionalInt toIntExact(Object value) {
    BigDecimal decimal;
    if (value instanceof Number n) {
      try {
        decimal = new BigDecimal(n.toString());
      } catch (NumberFormatException e) {
        // NaN and infinities
        return OptionalInt.empty();
      }
    } else if (value instanceof String s && NumberUtils.isDigits(s.trim())) {
      decimal = new BigDecimal(s.trim());
    } else {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(decimal.intValueExact());
    } catch (ArithmeticException e) {
      return OptionalInt.empty();
    }
  }
}
