package com.trino.client.api.impl.spooling;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.model.core.SegmentMetadata;
import java.io.IOException;

/** The {@code json} encoding: a plain JSON array of rows. */
public class JsonQueryDataDecoder implements QueryDataDecoder {

  public static final String ENCODING = "json";

  @Override
  public String getEncoding() {
    return ENCODING;
  }

  @Override
  public JsonNode decode(byte[] data, SegmentMetadata metadata) throws TrinoSQLException {
    JsonNode rows;
    try {
      rows = JsonUtil.getMapper().readTree(data);
    } catch (IOException e) {
      throw new TrinoProtocolException("Segment is not valid JSON: " + e.getMessage(), e);
    }
    if (rows == null || !rows.isArray()) {
      throw new TrinoProtocolException("Segment does not contain an array of rows");
    }
    return rows;
  }
}
