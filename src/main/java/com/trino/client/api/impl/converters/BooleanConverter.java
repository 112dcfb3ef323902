package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;

public class BooleanConverter implements ValueConverter {

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    String text = value.asText();
    if ("true".equalsIgnoreCase(text)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(text)) {
      return Boolean.FALSE;
    }
    throw new TrinoDataException("Server sent unexpected value " + value + " for boolean");
  }
}
