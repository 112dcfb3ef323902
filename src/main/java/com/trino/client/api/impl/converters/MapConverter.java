package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.trino.client.exception.TrinoDataException;
import com.trino.client.exception.TrinoSQLException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** Converts map values. JSON object keys are strings, so keys are re-read with the key type. */
public class MapConverter implements ValueConverter {

  private final ValueConverter keyConverter;
  private final ValueConverter valueConverter;

  MapConverter(ValueConverter keyConverter, ValueConverter valueConverter) {
    this.keyConverter = keyConverter;
    this.valueConverter = valueConverter;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoSQLException {
    if (!value.isObject()) {
      throw new TrinoDataException("Expected a JSON object for map value but got " + value);
    }
    Map<Object, Object> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      result.put(
          keyConverter.convert(TextNode.valueOf(field.getKey())),
          valueConverter.convertNullable(field.getValue()));
    }
    return result;
  }
}
