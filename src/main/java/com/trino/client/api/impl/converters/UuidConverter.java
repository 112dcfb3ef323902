package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;
import java.util.UUID;

public class UuidConverter implements ValueConverter {

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    try {
      return UUID.fromString(value.asText());
    } catch (IllegalArgumentException e) {
      throw new TrinoDataException(
          String.format("Could not convert '%s' into uuid", value.asText()), e);
    }
  }
}
