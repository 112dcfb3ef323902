package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.List;
import java.util.Objects;

/** Server-side failure details attached to a query error. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FailureInfo {
  @JsonProperty("type")
  private String type;

  @JsonProperty("message")
  private String message;

  @JsonProperty("cause")
  private FailureInfo cause;

  @JsonProperty("stack")
  private List<String> stack;

  public FailureInfo setType(String type) {
    this.type = type;
    return this;
  }

  public String getType() {
    return type;
  }

  public FailureInfo setMessage(String message) {
    this.message = message;
    return this;
  }

  public String getMessage() {
    return message;
  }

  public FailureInfo setCause(FailureInfo cause) {
    this.cause = cause;
    return this;
  }

  public FailureInfo getCause() {
    return cause;
  }

  public FailureInfo setStack(List<String> stack) {
    this.stack = stack;
    return this;
  }

  public List<String> getStack() {
    return stack;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FailureInfo that = (FailureInfo) o;
    return Objects.equals(type, that.type)
        && Objects.equals(message, that.message)
        && Objects.equals(cause, that.cause)
        && Objects.equals(stack, that.stack);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, message, cause, stack);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type)
        .add("message", message)
        .add("cause", cause)
        .add("stack", stack)
        .toString();
  }
}
