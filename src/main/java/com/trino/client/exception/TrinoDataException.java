package com.trino.client.exception;

/** A wire value could not be represented in the requested Java type. */
public class TrinoDataException extends TrinoSQLException {

  public TrinoDataException(String reason) {
    super(reason, TrinoDriverErrorCode.DATA_CONVERSION_ERROR);
  }

  public TrinoDataException(String reason, Throwable cause) {
    super(reason, cause, TrinoDriverErrorCode.DATA_CONVERSION_ERROR);
  }
}
