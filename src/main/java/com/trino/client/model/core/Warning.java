package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Warning attached to a statement response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Warning {
  @JsonProperty("warningCode")
  private JsonNode warningCode;

  @JsonProperty("message")
  private String message;

  public Warning setWarningCode(JsonNode warningCode) {
    this.warningCode = warningCode;
    return this;
  }

  public JsonNode getWarningCode() {
    return warningCode;
  }

  public Warning setMessage(String message) {
    this.message = message;
    return this;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Warning that = (Warning) o;
    return Objects.equals(warningCode, that.warningCode)
        && Objects.equals(message, that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(warningCode, message);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("warningCode", warningCode)
        .add("message", message)
        .toString();
  }
}
