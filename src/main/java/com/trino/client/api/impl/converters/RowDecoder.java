package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.api.impl.ColumnDescription;
import com.trino.client.exception.TrinoDataException;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Decodes JSON rows of a result page using the converters of each column. */
public class RowDecoder {

  private final List<ValueConverter> converters;

  public RowDecoder(List<ColumnDescription> columns, TypeMappingMode mode) {
    List<ValueConverter> list = new ArrayList<>(columns.size());
    for (ColumnDescription column : columns) {
      list.add(ValueConverterFactory.create(column.getSignature(), mode));
    }
    this.converters = Collections.unmodifiableList(list);
  }

  public int getColumnCount() {
    return converters.size();
  }

  /** Decodes a JSON array of rows. */
  public List<List<Object>> decodeRows(JsonNode rows) throws TrinoSQLException {
    if (rows == null || rows.isNull()) {
      return new ArrayList<>();
    }
    if (!rows.isArray()) {
      throw new TrinoProtocolException("Expected an array of rows but got " + rows.getNodeType());
    }
    List<List<Object>> result = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      result.add(decodeRow(row));
    }
    return result;
  }

  public List<Object> decodeRow(JsonNode row) throws TrinoSQLException {
    if (!row.isArray() || row.size() != converters.size()) {
      throw new TrinoProtocolException(
          String.format(
              "Row has %d values but the result has %d columns",
              row.isArray() ? row.size() : 1, converters.size()));
    }
    List<Object> values = new ArrayList<>(converters.size());
    for (int i = 0; i < converters.size(); i++) {
      JsonNode cell = row.get(i);
      try {
        values.add(converters.get(i).convertNullable(cell));
      } catch (RuntimeException e) {
        throw new TrinoDataException("Could not convert '" + cell + "' for column " + i, e);
      }
    }
    return values;
  }
}
