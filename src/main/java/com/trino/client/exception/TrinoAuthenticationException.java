package com.trino.client.exception;

/** Non-retryable rejection of the configured credentials. */
public class TrinoAuthenticationException extends TrinoSQLException {

  public TrinoAuthenticationException(String reason) {
    super(reason, TrinoDriverErrorCode.AUTHENTICATION_ERROR);
  }

  public TrinoAuthenticationException(String reason, Throwable cause) {
    super(reason, cause, TrinoDriverErrorCode.AUTHENTICATION_ERROR);
  }
}
