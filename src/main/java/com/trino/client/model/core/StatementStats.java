package com.trino.client.model.core;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution statistics of a statement. The commonly used fields are typed; everything else the
 * server sends is retained in {@link #getOther()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatementStats {
  @JsonProperty("state")
  private String state;

  @JsonProperty("queued")
  private Boolean queued;

  @JsonProperty("scheduled")
  private Boolean scheduled;

  @JsonProperty("progressPercentage")
  private Double progressPercentage;

  @JsonProperty("processedRows")
  private Long processedRows;

  @JsonProperty("processedBytes")
  private Long processedBytes;

  @JsonProperty("elapsedTimeMillis")
  private Long elapsedTimeMillis;

  private final Map<String, Object> other = new LinkedHashMap<>();

  public StatementStats setState(String state) {
    this.state = state;
    return this;
  }

  public String getState() {
    return state;
  }

  public StatementStats setQueued(Boolean queued) {
    this.queued = queued;
    return this;
  }

  public Boolean getQueued() {
    return queued;
  }

  public StatementStats setScheduled(Boolean scheduled) {
    this.scheduled = scheduled;
    return this;
  }

  public Boolean getScheduled() {
    return scheduled;
  }

  public StatementStats setProgressPercentage(Double progressPercentage) {
    this.progressPercentage = progressPercentage;
    return this;
  }

  public Double getProgressPercentage() {
    return progressPercentage;
  }

  public StatementStats setProcessedRows(Long processedRows) {
    this.processedRows = processedRows;
    return this;
  }

  public Long getProcessedRows() {
    return processedRows;
  }

  public StatementStats setProcessedBytes(Long processedBytes) {
    this.processedBytes = processedBytes;
    return this;
  }

  public Long getProcessedBytes() {
    return processedBytes;
  }

  public StatementStats setElapsedTimeMillis(Long elapsedTimeMillis) {
    this.elapsedTimeMillis = elapsedTimeMillis;
    return this;
  }

  public Long getElapsedTimeMillis() {
    return elapsedTimeMillis;
  }

  @JsonAnySetter
  public void setOther(String name, Object value) {
    other.put(name, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getOther() {
    return Collections.unmodifiableMap(other);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("progressPercentage", progressPercentage)
        .add("processedRows", processedRows)
        .add("elapsedTimeMillis", elapsedTimeMillis)
        .toString();
  }
}
