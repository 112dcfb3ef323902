package com.trino.client.exception;

import com.trino.client.model.core.QueryError;

/** Server error of type {@code INTERNAL_ERROR} or {@code INSUFFICIENT_RESOURCES}. */
public class TrinoInternalErrorException extends TrinoQueryException {

  public TrinoInternalErrorException(QueryError error, String queryId) {
    super(error, queryId);
  }
}
