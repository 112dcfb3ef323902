package com.trino.client.api.impl.spooling;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.model.core.SegmentMetadata;

/** Turns the bytes of one segment into a JSON array of rows, the same shape as inline data. */
public interface QueryDataDecoder {

  /** Encoding identifier as sent in {@code X-Trino-Query-Data-Encoding}. */
  String getEncoding();

  JsonNode decode(byte[] data, SegmentMetadata metadata) throws TrinoSQLException;
}
