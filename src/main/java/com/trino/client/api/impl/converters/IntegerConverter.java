package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;
import java.math.BigInteger;

/** Converts {@code tinyint}, {@code smallint}, {@code integer} and {@code bigint} values. */
public class IntegerConverter implements ValueConverter {

  enum Width {
    TINYINT(Byte.MIN_VALUE, Byte.MAX_VALUE),
    SMALLINT(Short.MIN_VALUE, Short.MAX_VALUE),
    INTEGER(Integer.MIN_VALUE, Integer.MAX_VALUE),
    BIGINT(Long.MIN_VALUE, Long.MAX_VALUE);

    private final BigInteger min;
    private final BigInteger max;

    Width(long min, long max) {
      this.min = BigInteger.valueOf(min);
      this.max = BigInteger.valueOf(max);
    }
  }

  private final Width width;

  IntegerConverter(Width width) {
    this.width = width;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    BigInteger number;
    if (value.isIntegralNumber()) {
      number = value.bigIntegerValue();
    } else if (value.isTextual()) {
      try {
        number = new BigInteger(value.textValue().trim());
      } catch (NumberFormatException e) {
        throw new TrinoDataException(
            String.format("Could not convert '%s' into %s", value.textValue(), typeName()), e);
      }
    } else {
      throw new TrinoDataException(
          String.format("Could not convert '%s' into %s", value, typeName()));
    }
    if (number.compareTo(width.min) < 0 || number.compareTo(width.max) > 0) {
      throw new TrinoDataException(
          String.format("Value %s is out of range for %s", number, typeName()));
    }
    switch (width) {
      case TINYINT:
        return number.byteValue();
      case SMALLINT:
        return number.shortValue();
      case INTEGER:
        return number.intValue();
      default:
        return number.longValue();
    }
  }

  private String typeName() {
    return width.name().toLowerCase();
  }
}
