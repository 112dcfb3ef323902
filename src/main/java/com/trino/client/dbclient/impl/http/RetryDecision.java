package com.trino.client.dbclient.impl.http;

import com.trino.client.exception.TrinoSQLException;
import java.time.Duration;

/** What to do after an HTTP attempt. */
public final class RetryDecision {

  public enum Action {
    RETURN,
    RETRY,
    FAIL
  }

  private static final RetryDecision RETURN = new RetryDecision(Action.RETURN, Duration.ZERO, null);

  private final Action action;
  private final Duration delay;
  private final TrinoSQLException failure;

  private RetryDecision(Action action, Duration delay, TrinoSQLException failure) {
    this.action = action;
    this.delay = delay;
    this.failure = failure;
  }

  static RetryDecision returnResponse() {
    return RETURN;
  }

  static RetryDecision retryAfter(Duration delay) {
    return new RetryDecision(Action.RETRY, delay, null);
  }

  static RetryDecision fail(TrinoSQLException failure) {
    return new RetryDecision(Action.FAIL, Duration.ZERO, failure);
  }

  public Action getAction() {
    return action;
  }

  public Duration getDelay() {
    return delay;
  }

  public TrinoSQLException getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return action == Action.RETRY ? "RETRY after " + delay : action.name();
  }
}
