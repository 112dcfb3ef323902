package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Position of a query error within the statement text. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorLocation {
  @JsonProperty("lineNumber")
  private Integer lineNumber;

  @JsonProperty("columnNumber")
  private Integer columnNumber;

  public ErrorLocation setLineNumber(Integer lineNumber) {
    this.lineNumber = lineNumber;
    return this;
  }

  public Integer getLineNumber() {
    return lineNumber;
  }

  public ErrorLocation setColumnNumber(Integer columnNumber) {
    this.columnNumber = columnNumber;
    return this;
  }

  public Integer getColumnNumber() {
    return columnNumber;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ErrorLocation that = (ErrorLocation) o;
    return Objects.equals(lineNumber, that.lineNumber)
        && Objects.equals(columnNumber, that.columnNumber);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lineNumber, columnNumber);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("lineNumber", lineNumber)
        .add("columnNumber", columnNumber)
        .toString();
  }
}
