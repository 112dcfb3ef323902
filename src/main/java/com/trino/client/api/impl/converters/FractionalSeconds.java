package com.trino.client.api.impl.converters;

import com.trino.client.exception.TrinoDataException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fractional part of a time literal, rounded to the declared precision.
 *
 * <p>Java temporal types stop at nanoseconds. Digits past the ninth are accepted only while they
 * are zero; anything finer than a nanosecond is reported as a data error instead of being
 * silently dropped.
 */
final class FractionalSeconds {

  static final FractionalSeconds ZERO = new FractionalSeconds(0, 0);

  private final long carrySeconds;
  private final int nanos;

  private FractionalSeconds(long carrySeconds, int nanos) {
    this.carrySeconds = carrySeconds;
    this.nanos = nanos;
  }

  static FractionalSeconds parse(String digits, int precision, String literal)
      throws TrinoDataException {
    if (digits.isEmpty()) {
      return ZERO;
    }
    for (int i = 0; i < digits.length(); i++) {
      if (!Character.isDigit(digits.charAt(i))) {
        throw new TrinoDataException("Invalid fractional seconds in '" + literal + "'");
      }
    }
    if (precision > 9) {
      for (int i = 9; i < digits.length(); i++) {
        if (digits.charAt(i) != '0') {
          throw new TrinoDataException(
              String.format(
                  "Value '%s' has sub-nanosecond precision that cannot be represented", literal));
        }
      }
    }
    BigDecimal fraction =
        new BigDecimal("0." + digits).setScale(Math.min(precision, 9), RoundingMode.HALF_UP);
    if (fraction.compareTo(BigDecimal.ONE) >= 0) {
      return new FractionalSeconds(1, 0);
    }
    return new FractionalSeconds(0, fraction.movePointRight(9).intValueExact());
  }

  /** One when rounding reached the next whole second. */
  long getCarrySeconds() {
    return carrySeconds;
  }

  int getNanos() {
    return nanos;
  }
}
