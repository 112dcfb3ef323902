package com.trino.client.exception;

import com.trino.client.model.core.QueryError;

/**
 * Error reported by the server for a query. The server's error code, name, type and message are
 * kept verbatim; the numeric error code doubles as the vendor code.
 */
public class TrinoQueryException extends TrinoSQLException {

  static final String DEFAULT_MESSAGE = "Trino did not return an error message";

  private final QueryError error;
  private final String queryId;

  public TrinoQueryException(QueryError error, String queryId) {
    super(
        messageOf(error),
        TrinoDriverErrorCode.QUERY_FAILED.name(),
        error.getErrorCode() == null ? 0 : error.getErrorCode(),
        TrinoDriverErrorCode.QUERY_FAILED);
    this.error = error;
    this.queryId = queryId;
  }

  /** Picks the subclass matching the server's {@code errorType}. */
  public static TrinoQueryException of(QueryError error, String queryId) {
    String errorType = error.getErrorType();
    if ("USER_ERROR".equals(errorType)) {
      return new TrinoUserErrorException(error, queryId);
    }
    if ("EXTERNAL".equals(errorType)) {
      return new TrinoExternalErrorException(error, queryId);
    }
    if ("INTERNAL_ERROR".equals(errorType) || "INSUFFICIENT_RESOURCES".equals(errorType)) {
      return new TrinoInternalErrorException(error, queryId);
    }
    return new TrinoQueryException(error, queryId);
  }

  private static String messageOf(QueryError error) {
    return error.getMessage() == null ? DEFAULT_MESSAGE : error.getMessage();
  }

  public QueryError getError() {
    return error;
  }

  public String getErrorName() {
    return error.getErrorName();
  }

  public String getErrorType() {
    return error.getErrorType();
  }

  /** Type of the server-side exception, from {@code failureInfo}, if any. */
  public String getErrorException() {
    return error.getFailureInfo() == null ? null : error.getFailureInfo().getType();
  }

  public String getQueryId() {
    return queryId;
  }

  @Override
  public String toString() {
    return String.format(
        "%s(type=%s, name=%s, message=\"%s\", query_id=%s)",
        getClass().getSimpleName(), getErrorType(), getErrorName(), getMessage(), queryId);
  }
}
