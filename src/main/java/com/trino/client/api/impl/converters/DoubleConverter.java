package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;

/**
 * Converts {@code double} and {@code real} values. Non-finite values arrive as the strings {@code
 * Infinity}, {@code -Infinity} and {@code NaN}.
 */
public class DoubleConverter implements ValueConverter {

  private final boolean real;

  DoubleConverter(boolean real) {
    this.real = real;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    double result;
    if (value.isNumber()) {
      result = value.doubleValue();
    } else if (value.isTextual()) {
      result = parse(value.textValue());
    } else {
      throw new TrinoDataException(
          String.format("Could not convert '%s' into %s", value, real ? "real" : "double"));
    }
    return real ? (Object) (float) result : (Object) result;
  }

  private double parse(String text) throws TrinoDataException {
    switch (text) {
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      case "NaN":
        return Double.NaN;
      default:
        try {
          return Double.parseDouble(text);
        } catch (NumberFormatException e) {
          throw new TrinoDataException(
              String.format("Could not convert '%s' into %s", text, real ? "real" : "double"), e);
        }
    }
  }
}
