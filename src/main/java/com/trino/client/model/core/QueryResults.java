package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import java.util.List;

/**
 * Envelope returned by the coordinator for a statement submission and for every subsequent poll.
 *
 * <p>{@code data} is left as a raw tree: it is either an array of rows or a spooled-data object
 * carrying an encoding and a list of segments, and can only be decoded once the column types are
 * known.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResults {
  @JsonProperty("id")
  private String id;

  @JsonProperty("infoUri")
  private String infoUri;

  @JsonProperty("partialCancelUri")
  private String partialCancelUri;

  @JsonProperty("nextUri")
  private String nextUri;

  @JsonProperty("columns")
  private List<Column> columns;

  @JsonProperty("data")
  private JsonNode data;

  @JsonProperty("stats")
  private StatementStats stats;

  @JsonProperty("error")
  private QueryError error;

  @JsonProperty("warnings")
  private List<Warning> warnings;

  @JsonProperty("updateType")
  private String updateType;

  @JsonProperty("updateCount")
  private Long updateCount;

  public QueryResults setId(String id) {
    this.id = id;
    return this;
  }

  public String getId() {
    return id;
  }

  public QueryResults setInfoUri(String infoUri) {
    this.infoUri = infoUri;
    return this;
  }

  public String getInfoUri() {
    return infoUri;
  }

  public QueryResults setPartialCancelUri(String partialCancelUri) {
    this.partialCancelUri = partialCancelUri;
    return this;
  }

  public String getPartialCancelUri() {
    return partialCancelUri;
  }

  public QueryResults setNextUri(String nextUri) {
    this.nextUri = nextUri;
    return this;
  }

  public String getNextUri() {
    return nextUri;
  }

  public QueryResults setColumns(List<Column> columns) {
    this.columns = columns;
    return this;
  }

  public List<Column> getColumns() {
    return columns;
  }

  public QueryResults setData(JsonNode data) {
    this.data = data;
    return this;
  }

  public JsonNode getData() {
    return data;
  }

  public QueryResults setStats(StatementStats stats) {
    this.stats = stats;
    return this;
  }

  public StatementStats getStats() {
    return stats;
  }

  public QueryResults setError(QueryError error) {
    this.error = error;
    return this;
  }

  public QueryError getError() {
    return error;
  }

  public QueryResults setWarnings(List<Warning> warnings) {
    this.warnings = warnings;
    return this;
  }

  public List<Warning> getWarnings() {
    return warnings;
  }

  public QueryResults setUpdateType(String updateType) {
    this.updateType = updateType;
    return this;
  }

  public String getUpdateType() {
    return updateType;
  }

  public QueryResults setUpdateCount(Long updateCount) {
    this.updateCount = updateCount;
    return this;
  }

  public Long getUpdateCount() {
    return updateCount;
  }

  /** A response without {@code nextUri} is the last one for its query. */
  public boolean isTerminal() {
    return nextUri == null;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("nextUri", nextUri)
        .add("columns", columns == null ? null : columns.size())
        .add("hasData", data != null && !data.isNull())
        .add("error", error)
        .add("updateType", updateType)
        .add("updateCount", updateCount)
        .toString();
  }
}
