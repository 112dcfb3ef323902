package com.trino.client.api.impl.converters;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoSQLException;

/** Converts one non-null wire value of a known column type into its Java representation. */
public interface ValueConverter {

  Object convert(JsonNode value) throws TrinoSQLException;

  /** Converts {@code value}, mapping JSON null and missing values to Java null. */
  default Object convertNullable(JsonNode value) throws TrinoSQLException {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return convert(value);
  }
}
