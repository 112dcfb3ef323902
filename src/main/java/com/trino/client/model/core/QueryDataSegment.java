package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.List;
import java.util.Map;

/**
 * One block of an encoded result page: either {@code inline} with base64 data, or {@code spooled}
 * with a URI to download it from and an optional URI to acknowledge it on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryDataSegment {
  public static final String TYPE_INLINE = "inline";
  public static final String TYPE_SPOOLED = "spooled";

  @JsonProperty("type")
  private String type;

  @JsonProperty("data")
  private byte[] data;

  @JsonProperty("uri")
  private String uri;

  @JsonProperty("ackUri")
  private String ackUri;

  @JsonProperty("headers")
  private Map<String, List<String>> headers;

  @JsonProperty("metadata")
  private SegmentMetadata metadata;

  public QueryDataSegment setType(String type) {
    this.type = type;
    return this;
  }

  public String getType() {
    return type;
  }

  public QueryDataSegment setData(byte[] data) {
    this.data = data;
    return this;
  }

  public byte[] getData() {
    return data;
  }

  public QueryDataSegment setUri(String uri) {
    this.uri = uri;
    return this;
  }

  public String getUri() {
    return uri;
  }

  public QueryDataSegment setAckUri(String ackUri) {
    this.ackUri = ackUri;
    return this;
  }

  public String getAckUri() {
    return ackUri;
  }

  public QueryDataSegment setHeaders(Map<String, List<String>> headers) {
    this.headers = headers;
    return this;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  public QueryDataSegment setMetadata(SegmentMetadata metadata) {
    this.metadata = metadata;
    return this;
  }

  public SegmentMetadata getMetadata() {
    return metadata;
  }

  public boolean isInline() {
    return TYPE_INLINE.equals(type);
  }

  public boolean isSpooled() {
    return TYPE_SPOOLED.equals(type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type)
        .add("uri", uri)
        .add("ackUri", ackUri)
        .add("dataLength", data == null ? null : data.length)
        .add("metadata", metadata)
        .toString();
  }
}
