package com.trino.client.api.impl;

import com.trino.client.api.ITrinoCursor;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.exception.TrinoValidationException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import com.trino.client.model.core.StatementStats;
import com.trino.client.model.core.Warning;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/** Cursor over the statements of one {@link TrinoConnection}. */
public class TrinoCursor implements ITrinoCursor {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(TrinoCursor.class);

  private final TrinoConnection connection;
  private volatile TrinoQuery query;
  private int arraySize = 1;
  private volatile boolean closed = false;

  TrinoCursor(TrinoConnection connection) {
    this.connection = connection;
  }

  @Override
  public void execute(String sql) throws TrinoSQLException {
    execute(sql, Collections.emptyList());
  }

  @Override
  public void execute(String sql, List<?> parameters) throws TrinoSQLException {
    LOGGER.debug("public void execute(String sql = {%s})", sql);
    checkOpen();
    connection.beginTransactionIfNeeded();
    if (parameters == null || parameters.isEmpty()) {
      start(sql);
    } else if (connection.useLegacyPreparedStatements()) {
      executeWithPrepare(sql, parameters);
    } else {
      start(
          "EXECUTE IMMEDIATE "
              + ParameterFormatter.quote(sql)
              + " USING "
              + ParameterFormatter.formatAll(parameters));
    }
  }

  @Override
  public void executeMany(String sql, List<? extends List<?>> parameterSets)
      throws TrinoSQLException {
    LOGGER.debug("public void executeMany(String sql = {%s})", sql);
    for (int i = 0; i < parameterSets.size(); i++) {
      execute(sql, parameterSets.get(i));
      if (i < parameterSets.size() - 1) {
        query.consumeAll();
      }
    }
  }

  /** Runs {@code PREPARE}, {@code EXECUTE} and {@code DEALLOCATE PREPARE} for the statement. */
  private void executeWithPrepare(String sql, List<?> parameters) throws TrinoSQLException {
    String name = "st_" + UUID.randomUUID().toString().replace("-", "");
    String executeSql = "EXECUTE " + name + " USING " + ParameterFormatter.formatAll(parameters);
    connection.runToCompletion("PREPARE " + name + " FROM " + sql);
    if (!connection.getSession().getPreparedStatements().containsKey(name)) {
      throw new TrinoProtocolException(
          "Server did not acknowledge prepared statement " + name,
          TrinoDriverErrorCode.PROTOCOL_ERROR);
    }
    TrinoSQLException failure = null;
    try {
      start(executeSql);
    } catch (TrinoSQLException e) {
      failure = e;
      throw e;
    } finally {
      deallocate(name, failure);
    }
  }

  private void deallocate(String name, TrinoSQLException pending) throws TrinoSQLException {
    try {
      connection.runToCompletion("DEALLOCATE PREPARE " + name);
    } catch (TrinoSQLException e) {
      if (pending == null) {
        throw e;
      }
      LOGGER.debug("Failed to deallocate %s after a failed execution: %s", name, e.getMessage());
      pending.addSuppressed(e);
    }
  }

  private void start(String sql) throws TrinoSQLException {
    TrinoQuery next = connection.newQuery();
    query = next;
    next.submit(new StatementRequest(sql, connection.getSession().snapshot()));
    next.awaitFirstRow();
  }

  @Override
  public List<Object> fetchOne() throws TrinoSQLException {
    return requireQuery().nextRow();
  }

  @Override
  public List<List<Object>> fetchMany(int size) throws TrinoSQLException {
    TrinoQuery current = requireQuery();
    List<List<Object>> rows = new ArrayList<>();
    while (rows.size() < size) {
      List<Object> row = current.nextRow();
      if (row == null) {
        break;
      }
      rows.add(row);
    }
    return rows;
  }

  @Override
  public List<List<Object>> fetchMany() throws TrinoSQLException {
    return fetchMany(arraySize);
  }

  @Override
  public List<List<Object>> fetchAll() throws TrinoSQLException {
    TrinoQuery current = requireQuery();
    List<List<Object>> rows = new ArrayList<>();
    for (List<Object> row = current.nextRow(); row != null; row = current.nextRow()) {
      rows.add(row);
    }
    return rows;
  }

  @Override
  public void cancel() throws TrinoSQLException {
    LOGGER.debug("public void cancel()");
    TrinoQuery current = query;
    if (current == null) {
      throw new TrinoValidationException(
          "Cancel query failed; no running query", TrinoDriverErrorCode.INVALID_STATE);
    }
    current.cancel();
  }

  @Override
  public void close() {
    LOGGER.debug("public void close()");
    if (closed) {
      return;
    }
    closed = true;
    TrinoQuery current = query;
    if (current != null && current.getState() == QueryState.RUNNING) {
      current.cancel();
    }
    connection.removeCursor(this);
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public List<ColumnDescription> getDescription() {
    TrinoQuery current = query;
    return current == null ? null : current.getColumns();
  }

  @Override
  public long getRowCount() {
    TrinoQuery current = query;
    Long count = current == null ? null : current.getUpdateCount();
    return count == null ? -1 : count;
  }

  @Override
  public String getQueryId() {
    TrinoQuery current = query;
    return current == null ? null : current.getQueryId();
  }

  @Override
  public String getInfoUri() {
    TrinoQuery current = query;
    return current == null ? null : current.getInfoUri();
  }

  @Override
  public String getUpdateType() {
    TrinoQuery current = query;
    return current == null ? null : current.getUpdateType();
  }

  @Override
  public StatementStats getStats() {
    TrinoQuery current = query;
    return current == null ? null : current.getStats();
  }

  @Override
  public List<Warning> getWarnings() {
    TrinoQuery current = query;
    return current == null ? Collections.emptyList() : current.getWarnings();
  }

  @Override
  public int getArraySize() {
    return arraySize;
  }

  @Override
  public void setArraySize(int arraySize) throws TrinoValidationException {
    if (arraySize < 1) {
      throw new TrinoValidationException(
          "arraySize must be positive: " + arraySize, TrinoDriverErrorCode.INVALID_ARGUMENT);
    }
    this.arraySize = arraySize;
  }

  private TrinoQuery requireQuery() throws TrinoValidationException {
    checkOpen();
    TrinoQuery current = query;
    if (current == null) {
      throw new TrinoValidationException(
          "No statement has been executed", TrinoDriverErrorCode.INVALID_STATE);
    }
    return current;
  }

  private void checkOpen() throws TrinoValidationException {
    if (closed) {
      throw new TrinoValidationException(
          "Cursor is closed", TrinoDriverErrorCode.INVALID_STATE);
    }
    if (connection.isClosed()) {
      throw new TrinoValidationException(
          "Connection is closed", TrinoDriverErrorCode.INVALID_STATE);
    }
  }
}
