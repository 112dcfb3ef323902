package com.trino.client.exception;

import java.sql.SQLException;

/** Top level exception for the Trino client. */
public class TrinoSQLException extends SQLException {

  private final TrinoDriverErrorCode internalError;

  public TrinoSQLException(String reason, TrinoDriverErrorCode internalError) {
    super(reason, internalError.name());
    this.internalError = internalError;
  }

  public TrinoSQLException(String reason, Throwable cause, TrinoDriverErrorCode internalError) {
    super(reason, internalError.name(), cause);
    this.internalError = internalError;
  }

  public TrinoSQLException(
      String reason, String sqlState, int vendorCode, TrinoDriverErrorCode internalError) {
    super(reason, sqlState, vendorCode);
    this.internalError = internalError;
  }

  public TrinoSQLException(
      String reason,
      String sqlState,
      int vendorCode,
      Throwable cause,
      TrinoDriverErrorCode internalError) {
    super(reason, sqlState, vendorCode, cause);
    this.internalError = internalError;
  }

  public TrinoDriverErrorCode getInternalError() {
    return internalError;
  }
}
