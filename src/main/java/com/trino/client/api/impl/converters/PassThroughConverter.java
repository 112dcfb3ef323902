package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.exception.TrinoDataException;

/**
 * Returns values as plain JSON objects: strings, numbers, booleans, {@code List} and {@code Map}.
 * Used for legacy primitive mapping and for types without a dedicated converter.
 */
public class PassThroughConverter implements ValueConverter {

  static final PassThroughConverter INSTANCE = new PassThroughConverter();

  @Override
  public Object convert(JsonNode value) throws TrinoDataException {
    if (value.isTextual()) {
      return value.textValue();
    }
    try {
      return JsonUtil.getMapper().treeToValue(value, Object.class);
    } catch (JsonProcessingException e) {
      throw new TrinoDataException("Could not read value " + value, e);
    }
  }
}
