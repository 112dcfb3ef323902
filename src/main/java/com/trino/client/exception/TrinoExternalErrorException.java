package com.trino.client.exception;

import com.trino.client.model.core.QueryError;

/** Server error of type {@code EXTERNAL}. */
public class TrinoExternalErrorException extends TrinoQueryException {

  public TrinoExternalErrorException(QueryError error, String queryId) {
    super(error, queryId);
  }
}
