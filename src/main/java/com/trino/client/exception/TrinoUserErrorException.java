package com.trino.client.exception;

import com.trino.client.model.core.QueryError;

/** Server error of type {@code USER_ERROR}. */
public class TrinoUserErrorException extends TrinoQueryException {

  public TrinoUserErrorException(QueryError error, String queryId) {
    super(error, queryId);
  }
}
