package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Converts {@code decimal(p,s)} values, which the server sends as strings. */
public class DecimalConverter implements ValueConverter {

  private final Integer scale;

  DecimalConverter(Integer scale) {
    this.scale = scale;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    BigDecimal decimal;
    try {
      decimal = value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText().trim());
    } catch (NumberFormatException e) {
      throw new TrinoDataException(
          String.format("Could not convert '%s' into decimal", value.asText()), e);
    }
    if (scale == null) {
      return decimal;
    }
    try {
      return decimal.setScale(scale, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      throw new TrinoDataException(
          String.format("Value %s does not fit decimal scale %d", decimal, scale), e);
    }
  }
}
