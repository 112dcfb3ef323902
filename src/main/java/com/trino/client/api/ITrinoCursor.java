package com.trino.client.api;

import com.trino.client.api.impl.ColumnDescription;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.model.core.StatementStats;
import com.trino.client.model.core.Warning;
import java.util.List;

/**
 * Interface for running statements and reading their results one row at a time.
 *
 * <p>A cursor runs one statement at a time. Executing a new statement replaces the previous
 * result. Rows are delivered exactly once, in the order the server produced them.
 */
public interface ITrinoCursor extends AutoCloseable {

  /**
   * Runs a statement without parameters and waits for its first row or its completion.
   *
   * @param sql statement text
   * @throws TrinoSQLException if the statement fails before producing a row
   */
  void execute(String sql) throws TrinoSQLException;

  /**
   * Runs a statement with positional {@code ?} parameters bound to the given values.
   *
   * @param sql statement text
   * @param parameters values bound in order; an empty list runs the statement as is
   * @throws TrinoSQLException if a value cannot be bound or the statement fails before producing
   *     a row
   */
  void execute(String sql, List<?> parameters) throws TrinoSQLException;

  /**
   * Runs a statement once per parameter set. The cursor then reflects the last execution.
   *
   * @param sql statement text
   * @param parameterSets one list of values per execution
   * @throws TrinoSQLException if any execution fails
   */
  void executeMany(String sql, List<? extends List<?>> parameterSets) throws TrinoSQLException;

  /**
   * Returns the next row.
   *
   * @return the row, or null once the result is exhausted
   * @throws TrinoSQLException the error reported by the server, once rows before it are consumed
   */
  List<Object> fetchOne() throws TrinoSQLException;

  /**
   * Returns up to {@code size} rows, fewer only when the result is exhausted.
   *
   * @param size maximum number of rows
   * @return the rows, empty once the result is exhausted
   * @throws TrinoSQLException the error reported by the server
   */
  List<List<Object>> fetchMany(int size) throws TrinoSQLException;

  /**
   * Returns up to {@link #getArraySize()} rows.
   *
   * @return the rows, empty once the result is exhausted
   * @throws TrinoSQLException the error reported by the server
   */
  List<List<Object>> fetchMany() throws TrinoSQLException;

  /**
   * Returns every remaining row.
   *
   * @return the rows
   * @throws TrinoSQLException the error reported by the server
   */
  List<List<Object>> fetchAll() throws TrinoSQLException;

  /**
   * Cancels the running statement. Failures to reach the server are not reported.
   *
   * @throws TrinoSQLException if no statement has been executed
   */
  void cancel() throws TrinoSQLException;

  /** Closes the cursor, cancelling a statement whose rows were not all read. Idempotent. */
  @Override
  void close() throws TrinoSQLException;

  boolean isClosed();

  /**
   * Returns the result columns.
   *
   * @return column descriptions, or null when no statement ran or the statement has no result set
   */
  List<ColumnDescription> getDescription();

  /**
   * Returns the number of rows changed by the last statement.
   *
   * @return the update count, or -1 when it is unknown
   */
  long getRowCount();

  String getQueryId();

  String getInfoUri();

  String getUpdateType();

  StatementStats getStats();

  List<Warning> getWarnings();

  int getArraySize();

  void setArraySize(int arraySize) throws TrinoSQLException;
}
