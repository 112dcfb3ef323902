package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.api.impl.TrinoStruct;
import com.trino.client.exception.TrinoDataException;
import com.trino.client.exception.TrinoSQLException;
import java.util.ArrayList;
import java.util.List;

/** Converts {@code row(...)} values into {@link TrinoStruct}. */
public class RowConverter implements ValueConverter {

  private final List<ValueConverter> fieldConverters;
  private final List<String> fieldNames;
  private final List<String> fieldTypes;

  RowConverter(
      List<ValueConverter> fieldConverters, List<String> fieldNames, List<String> fieldTypes) {
    this.fieldConverters = fieldConverters;
    this.fieldNames = fieldNames;
    this.fieldTypes = fieldTypes;
  }

  @Override
  public Object convert(JsonNode value) throws TrinoSQLException {
    if (!value.isArray() || value.size() != fieldConverters.size()) {
      throw new TrinoDataException(
          String.format(
              "Expected a row of %d fields but got %s", fieldConverters.size(), value));
    }
    List<Object> values = new ArrayList<>(fieldConverters.size());
    for (int i = 0; i < fieldConverters.size(); i++) {
      values.add(fieldConverters.get(i).convertNullable(value.get(i)));
    }
    return new TrinoStruct(values, fieldNames, fieldTypes);
  }
}
