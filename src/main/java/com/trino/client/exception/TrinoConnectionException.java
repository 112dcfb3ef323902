package com.trino.client.exception;

/** Raised when the coordinator is unreachable or retries have been exhausted. */
public class TrinoConnectionException extends TrinoSQLException {

  public TrinoConnectionException(String reason, TrinoDriverErrorCode internalError) {
    super(reason, internalError);
  }

  public TrinoConnectionException(
      String reason, Throwable cause, TrinoDriverErrorCode internalError) {
    super(reason, cause, internalError);
  }
}
