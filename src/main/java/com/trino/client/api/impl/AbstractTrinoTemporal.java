package com.trino.client.api.impl;

import com.trino.client.api.ITrinoTemporal;
import java.util.Objects;

/**
 * Base class for precision-carrying temporal values.
 *
 * <p>Subclasses supply the whole-second part of the literal; this class appends the fractional
 * digits so that a precision-6 value always renders six digits.
 */
public abstract class AbstractTrinoTemporal<T> implements ITrinoTemporal<T> {

  public static final int MAX_PRECISION = 12;
  public static final int DEFAULT_PRECISION = 3;

  private final T value;
  private final int precision;

  protected AbstractTrinoTemporal(T value, int precision) {
    if (precision < 0 || precision > MAX_PRECISION) {
      throw new IllegalArgumentException("Invalid temporal precision: " + precision);
    }
    this.value = Objects.requireNonNull(value, "value");
    this.precision = precision;
  }

  @Override
  public T getValue() {
    return value;
  }

  @Override
  public int getPrecision() {
    return precision;
  }

  /** Nanosecond part of the value. */
  protected abstract int getNanos();

  /** Literal up to and including the seconds field. */
  protected abstract String formatWholeSeconds();

  /** Text following the fraction, such as a zone; empty by default. */
  protected String formatSuffix() {
    return "";
  }

  @Override
  public String toWireLiteral() {
    StringBuilder builder = new StringBuilder(formatWholeSeconds());
    if (precision > 0) {
      String nanos = String.format("%09d", getNanos());
      builder.append('.');
      if (precision <= 9) {
        builder.append(nanos, 0, precision);
      } else {
        builder.append(nanos);
        for (int i = 9; i < precision; i++) {
          builder.append('0');
        }
      }
    }
    return builder.append(formatSuffix()).toString();
  }

  @Override
  public String toString() {
    return toWireLiteral();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    AbstractTrinoTemporal<?> that = (AbstractTrinoTemporal<?>) obj;
    return precision == that.precision && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, precision);
  }
}
