package com.trino.client.exception;

/** Invalid configuration or arguments, or an operation attempted in the wrong state. */
public class TrinoValidationException extends TrinoSQLException {

  public TrinoValidationException(String reason) {
    super(reason, TrinoDriverErrorCode.INVALID_ARGUMENT);
  }

  public TrinoValidationException(String reason, TrinoDriverErrorCode internalError) {
    super(reason, internalError);
  }

  public TrinoValidationException(String reason, Throwable cause) {
    super(reason, cause, TrinoDriverErrorCode.INVALID_ARGUMENT);
  }
}
