package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/** Position and size information of a result segment. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SegmentMetadata {
  @JsonProperty("rowOffset")
  private Long rowOffset;

  @JsonProperty("rowsCount")
  private Long rowsCount;

  @JsonProperty("segmentSize")
  private Long segmentSize;

  /** Present only when the segment data is compressed. */
  @JsonProperty("uncompressedSize")
  private Long uncompressedSize;

  public SegmentMetadata setRowOffset(Long rowOffset) {
    this.rowOffset = rowOffset;
    return this;
  }

  public Long getRowOffset() {
    return rowOffset;
  }

  public SegmentMetadata setRowsCount(Long rowsCount) {
    this.rowsCount = rowsCount;
    return this;
  }

  public Long getRowsCount() {
    return rowsCount;
  }

  public SegmentMetadata setSegmentSize(Long segmentSize) {
    this.segmentSize = segmentSize;
    return this;
  }

  public Long getSegmentSize() {
    return segmentSize;
  }

  public SegmentMetadata setUncompressedSize(Long uncompressedSize) {
    this.uncompressedSize = uncompressedSize;
    return this;
  }

  public Long getUncompressedSize() {
    return uncompressedSize;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("rowOffset", rowOffset)
        .add("rowsCount", rowsCount)
        .add("segmentSize", segmentSize)
        .add("uncompressedSize", uncompressedSize)
        .toString();
  }
}
