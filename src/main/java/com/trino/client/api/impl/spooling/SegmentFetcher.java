package com.trino.client.api.impl.spooling;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import com.trino.client.model.core.QueryDataSegment;
import java.util.List;
import java.util.Map;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;

/**
 * Resolves one segment to decoded rows.
 *
 * <p>Spooled segments are downloaded through the connection's HTTP client, so they get the same
 * credentials, TLS setup and retries as the polling requests. After a successful decode the
 * segment is acknowledged once; a failed acknowledgement is logged and the rows are still
 * returned.
 */
public class SegmentFetcher {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(SegmentFetcher.class);

  private final ITrinoHttpClient httpClient;

  public SegmentFetcher(ITrinoHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  public JsonNode fetch(QueryDataSegment segment, QueryDataDecoder decoder)
      throws TrinoSQLException {
    if (segment.isInline()) {
      if (segment.getData() == null) {
        throw new TrinoProtocolException("Inline segment carries no data");
      }
      return decoder.decode(segment.getData(), segment.getMetadata());
    }
    if (!segment.isSpooled()) {
      throw new TrinoProtocolException("Unknown segment type: " + segment.getType());
    }
    if (segment.getUri() == null) {
      throw new TrinoProtocolException("Spooled segment carries no uri");
    }
    JsonNode rows = decoder.decode(download(segment), segment.getMetadata());
    acknowledge(segment);
    return rows;
  }

  private byte[] download(QueryDataSegment segment) throws TrinoSQLException {
    HttpGet get = new HttpGet(segment.getUri());
    if (segment.getHeaders() != null) {
      for (Map.Entry<String, List<String>> header : segment.getHeaders().entrySet()) {
        for (String value : header.getValue()) {
          get.addHeader(header.getKey(), value);
        }
      }
    }
    LOGGER.debug("Downloading segment %s", segment.getMetadata());
    TrinoHttpResponse response = httpClient.execute(get);
    if (!response.isSuccessful()) {
      throw new TrinoProtocolException(
          "Segment download returned HTTP " + response.getStatusCode(),
          TrinoDriverErrorCode.SEGMENT_DOWNLOAD_ERROR);
    }
    return response.getBody();
  }

  private void acknowledge(QueryDataSegment segment) {
    if (segment.getAckUri() == null) {
      return;
    }
    try {
      TrinoHttpResponse response = httpClient.executeOnce(new HttpPost(segment.getAckUri()));
      if (!response.isSuccessful()) {
        LOGGER.warn(
            "Segment acknowledgement %s returned HTTP %d",
            segment.getAckUri(), response.getStatusCode());
      }
    } catch (TrinoSQLException e) {
      LOGGER.warn("Segment acknowledgement %s failed: %s", segment.getAckUri(), e.getMessage());
    }
  }
}
