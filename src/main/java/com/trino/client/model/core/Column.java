package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Column descriptor as delivered in a statement response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Column {
  @JsonProperty("name")
  private String name;

  @JsonProperty("type")
  private String type;

  @JsonProperty("typeSignature")
  private JsonNode typeSignature;

  public Column setName(String name) {
    this.name = name;
    return this;
  }

  public String getName() {
    return name;
  }

  public Column setType(String type) {
    this.type = type;
    return this;
  }

  public String getType() {
    return type;
  }

  public Column setTypeSignature(JsonNode typeSignature) {
    this.typeSignature = typeSignature;
    return this;
  }

  public JsonNode getTypeSignature() {
    return typeSignature;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Column that = (Column) o;
    return Objects.equals(name, that.name)
        && Objects.equals(type, that.type)
        && Objects.equals(typeSignature, that.typeSignature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, typeSignature);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("type", type)
        .add("typeSignature", typeSignature)
        .toString();
  }
}
