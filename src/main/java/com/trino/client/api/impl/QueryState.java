package com.trino.client.api.impl;

/** Lifecycle of one statement execution. States only move forward. */
public enum QueryState {
  CREATED,
  RUNNING,
  /** The last page has arrived but its rows have not all been handed out. */
  FINISHING,
  FINISHED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == FINISHED || this == FAILED || this == CANCELLED;
  }
}
