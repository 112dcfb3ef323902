package com.trino.client.exception;

import java.sql.SQLException;

/**
 * Failure to start, commit or roll back a transaction. The SQL state and vendor code of the
 * underlying error are kept when it has them.
 */
public class TrinoTransactionException extends TrinoSQLException {

  public TrinoTransactionException(String reason) {
    super(reason, TrinoDriverErrorCode.TRANSACTION_ERROR);
  }

  public TrinoTransactionException(String reason, Throwable cause) {
    super(
        reason,
        getSqlStateFromCause(cause),
        getVendorCodeFromCause(cause),
        cause,
        TrinoDriverErrorCode.TRANSACTION_ERROR);
  }

  private static String getSqlStateFromCause(Throwable cause) {
    if (cause instanceof SQLException) {
      String sqlState = ((SQLException) cause).getSQLState();
      if (sqlState != null && !sqlState.isEmpty()) {
        return sqlState;
      }
    }
    return TrinoDriverErrorCode.TRANSACTION_ERROR.name();
  }

  private static int getVendorCodeFromCause(Throwable cause) {
    return cause instanceof SQLException ? ((SQLException) cause).getErrorCode() : 0;
  }
}
