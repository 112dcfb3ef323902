package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoDataException;
import com.trino.client.exception.TrinoSQLException;
import java.util.ArrayList;
import java.util.List;

public class ArrayConverter implements ValueConverter {

  private final ValueConverter elementConverter;

  ArrayConverter(ValueConverter elementConverter) {
    this.elementConverter = elementConverter;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoSQLException {
    if (!value.isArray()) {
      throw new TrinoDataException("Expected a JSON array for array value but got " + value);
    }
    List<Object> result = new ArrayList<>(value.size());
    for (JsonNode element : value) {
      result.add(elementConverter.convertNullable(element));
    }
    return result;
  }
}
