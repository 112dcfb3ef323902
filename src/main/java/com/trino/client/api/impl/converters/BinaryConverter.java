package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.io.BaseEncoding;
import com.trino.client.exception.TrinoDataException;

/** Converts base64 encoded {@code varbinary} values. */
public class BinaryConverter implements ValueConverter {

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    try {
      return BaseEncoding.base64().decode(value.asText());
    } catch (IllegalArgumentException e) {
      throw new TrinoDataException("Invalid base64 value for varbinary", e);
    }
  }
}
