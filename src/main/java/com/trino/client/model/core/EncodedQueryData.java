package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.List;

/** The object form of {@code data}: an encoding identifier and the segments to decode with it. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EncodedQueryData {
  @JsonProperty("encoding")
  private String encoding;

  @JsonProperty("segments")
  private List<QueryDataSegment> segments;

  public EncodedQueryData setEncoding(String encoding) {
    this.encoding = encoding;
    return this;
  }

  public String getEncoding() {
    return encoding;
  }

  public EncodedQueryData setSegments(List<QueryDataSegment> segments) {
    this.segments = segments;
    return this;
  }

  public List<QueryDataSegment> getSegments() {
    return segments;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("encoding", encoding)
        .add("segments", segments)
        .toString();
  }
}
