package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts character and textual types. {@code json} columns are usually sent as strings; any
 * other node is rendered as JSON text.
 */
public class StringConverter implements ValueConverter {

  @Override
  public Object convert(JsonNode value) {
    return value.isTextual() ? value.textValue() : value.toString();
  }
}
