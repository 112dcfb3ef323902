package com.trino.client.exception;

/**
 * Raised when the server sends something the client cannot interpret: a malformed envelope, a
 * column set that changed mid-query, or a spooled segment in an unsupported encoding. Never
 * retried.
 */
public class TrinoProtocolException extends TrinoSQLException {

  public TrinoProtocolException(String reason) {
    super(reason, TrinoDriverErrorCode.PROTOCOL_ERROR);
  }

  public TrinoProtocolException(String reason, TrinoDriverErrorCode internalError) {
    super(reason, internalError);
  }

  public TrinoProtocolException(String reason, Throwable cause) {
    super(reason, cause, TrinoDriverErrorCode.PROTOCOL_ERROR);
  }
}
