package com.trino.client.api.impl.spooling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.model.core.EncodedQueryData;
import com.trino.client.model.core.QueryDataSegment;

/**
 * Reads the {@code data} field of a result page, which is either an array of rows or an encoded
 * object referencing segments, and returns the rows as one JSON array in page order.
 */
public class QueryDataReader {

  private final SegmentFetcher segmentFetcher;

  public QueryDataReader(SegmentFetcher segmentFetcher) {
    this.segmentFetcher = segmentFetcher;
  }

  /** Rows of the page, or null when the page carries no data. */
  public JsonNode read(JsonNode data) throws TrinoSQLException {
    if (data == null || data.isNull() || data.isMissingNode()) {
      return null;
    }
    if (data.isArray()) {
      return data;
    }
    if (!data.isObject()) {
      throw new TrinoProtocolException("Unexpected data field: " + data.getNodeType());
    }
    EncodedQueryData encoded;
    try {
      encoded = JsonUtil.getMapper().treeToValue(data, EncodedQueryData.class);
    } catch (JsonProcessingException e) {
      throw new TrinoProtocolException("Malformed encoded data: " + e.getMessage(), e);
    }
    QueryDataDecoder decoder = QueryDataDecoders.forEncoding(encoded.getEncoding());
    ArrayNode rows = JsonUtil.getMapper().createArrayNode();
    if (encoded.getSegments() == null) {
      return rows;
    }
    for (QueryDataSegment segment : encoded.getSegments()) {
      rows.addAll((ArrayNode) segmentFetcher.fetch(segment, decoder));
    }
    return rows;
  }
}
