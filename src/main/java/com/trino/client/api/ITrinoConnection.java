package com.trino.client.api;

import com.trino.client.common.IsolationLevel;
import com.trino.client.exception.TrinoSQLException;

/**
 * Interface for a logical connection to a Trino coordinator.
 *
 * <p>A connection holds the session state shared by its cursors: catalog, schema, session
 * properties, roles, prepared statements and the open transaction. When the isolation level is
 * not {@link IsolationLevel#AUTOCOMMIT}, a transaction is started by the first statement and
 * stays open until {@link #commit()} or {@link #rollback()}.
 */
public interface ITrinoConnection extends AutoCloseable {

  /**
   * Creates a cursor bound to this connection.
   *
   * @return a new cursor
   * @throws TrinoSQLException if the connection is closed
   */
  ITrinoCursor cursor() throws TrinoSQLException;

  /**
   * Commits the open transaction. Does nothing when no transaction is open.
   *
   * @throws TrinoSQLException if the commit fails
   */
  void commit() throws TrinoSQLException;

  /**
   * Rolls back the open transaction.
   *
   * @throws TrinoSQLException if no transaction is open or the rollback fails
   */
  void rollback() throws TrinoSQLException;

  /**
   * Closes the cursors, rolls back an open transaction and releases the HTTP client. Idempotent.
   */
  @Override
  void close() throws TrinoSQLException;

  boolean isClosed();

  IsolationLevel getIsolationLevel();

  /**
   * Returns the id of the open transaction.
   *
   * @return the transaction id, or null in autocommit mode or before the first statement
   */
  String getTransactionId();
}
