package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Error block of a statement response. Values are kept exactly as sent by the server. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryError {
  @JsonProperty("message")
  private String message;

  @JsonProperty("sqlState")
  private String sqlState;

  @JsonProperty("errorCode")
  private Integer errorCode;

  @JsonProperty("errorName")
  private String errorName;

  @JsonProperty("errorType")
  private String errorType;

  @JsonProperty("errorLocation")
  private ErrorLocation errorLocation;

  @JsonProperty("failureInfo")
  private FailureInfo failureInfo;

  public QueryError setMessage(String message) {
    this.message = message;
    return this;
  }

  public String getMessage() {
    return message;
  }

  public QueryError setSqlState(String sqlState) {
    this.sqlState = sqlState;
    return this;
  }

  public String getSqlState() {
    return sqlState;
  }

  public QueryError setErrorCode(Integer errorCode) {
    this.errorCode = errorCode;
    return this;
  }

  public Integer getErrorCode() {
    return errorCode;
  }

  public QueryError setErrorName(String errorName) {
    this.errorName = errorName;
    return this;
  }

  public String getErrorName() {
    return errorName;
  }

  public QueryError setErrorType(String errorType) {
    this.errorType = errorType;
    return this;
  }

  public String getErrorType() {
    return errorType;
  }

  public QueryError setErrorLocation(ErrorLocation errorLocation) {
    this.errorLocation = errorLocation;
    return this;
  }

  public ErrorLocation getErrorLocation() {
    return errorLocation;
  }

  public QueryError setFailureInfo(FailureInfo failureInfo) {
    this.failureInfo = failureInfo;
    return this;
  }

  public FailureInfo getFailureInfo() {
    return failureInfo;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    QueryError that = (QueryError) o;
    return Objects.equals(message, that.message)
        && Objects.equals(sqlState, that.sqlState)
        && Objects.equals(errorCode, that.errorCode)
        && Objects.equals(errorName, that.errorName)
        && Objects.equals(errorType, that.errorType)
        && Objects.equals(errorLocation, that.errorLocation)
        && Objects.equals(failureInfo, that.failureInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        message, sqlState, errorCode, errorName, errorType, errorLocation, failureInfo);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("message", message)
        .add("sqlState", sqlState)
        .add("errorCode", errorCode)
        .add("errorName", errorName)
        .add("errorType", errorType)
        .add("errorLocation", errorLocation)
        .add("failureInfo", failureInfo)
        .toString();
  }
}
