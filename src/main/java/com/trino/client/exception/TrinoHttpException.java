package com.trino.client.exception;

/** Non-retryable HTTP failure. Carries the status code as the vendor code. */
public class TrinoHttpException extends TrinoSQLException {

  private final int statusCode;

  public TrinoHttpException(String reason, int statusCode) {
    super(
        reason,
        TrinoDriverErrorCode.HTTP_ERROR.name(),
        statusCode,
        TrinoDriverErrorCode.HTTP_ERROR);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
