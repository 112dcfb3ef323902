package com.trino.client.api.impl;

import com.google.common.annotations.VisibleForTesting;
import com.trino.client.api.ITrinoConnection;
import com.trino.client.api.ITrinoCursor;
import com.trino.client.api.impl.converters.TypeMappingMode;
import com.trino.client.api.impl.session.SessionSnapshot;
import com.trino.client.api.impl.session.TrinoSession;
import com.trino.client.api.impl.spooling.QueryDataReader;
import com.trino.client.api.impl.spooling.SegmentFetcher;
import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.auth.AuthenticationStrategyFactory;
import com.trino.client.common.IsolationLevel;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.dbclient.impl.http.TrinoHttpClientFactory;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.exception.TrinoTransactionException;
import com.trino.client.exception.TrinoValidationException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.io.IOException;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection to a Trino coordinator.
 *
 * <p>Owns the HTTP client shared by all statements, the session state, and the cursors it
 * created. Session changes reported by the server flow through {@link TrinoSession} only.
 */
public class TrinoConnection implements ITrinoConnection {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(TrinoConnection.class);
  private static final String CAPABILITY_PROBE = "EXECUTE IMMEDIATE 'SELECT 1'";

  private final ITrinoConnectionContext connectionContext;
  private final ITrinoHttpClient httpClient;
  private final TrinoSession session;
  private final QueryDataReader dataReader;
  private final TypeMappingMode typeMappingMode;
  private final Set<TrinoCursor> cursors = ConcurrentHashMap.newKeySet();
  private final Object capabilityLock = new Object();
  private Boolean legacyPreparedStatements;
  private volatile boolean closed = false;

  /**
   * Creates a connection from a URL such as {@code trino://host:8443/catalog/schema?user=me}.
   *
   * @throws TrinoSQLException if the URL or the properties are invalid
   */
  public static TrinoConnection open(String url, Properties properties) throws TrinoSQLException {
    return new TrinoConnection(TrinoConnectionContextFactory.create(url, properties));
  }

  public TrinoConnection(ITrinoConnectionContext connectionContext) throws TrinoSQLException {
    this(
        connectionContext,
        TrinoHttpClientFactory.create(
            connectionContext, AuthenticationStrategyFactory.create(connectionContext)));
  }

  @VisibleForTesting
  TrinoConnection(ITrinoConnectionContext connectionContext, ITrinoHttpClient httpClient) {
    this.connectionContext = connectionContext;
    this.httpClient = httpClient;
    this.session = new TrinoSession(connectionContext);
    this.dataReader = new QueryDataReader(new SegmentFetcher(httpClient));
    this.typeMappingMode =
        connectionContext.isLegacyPrimitiveTypes()
            ? TypeMappingMode.LEGACY_PRIMITIVE
            : TypeMappingMode.TYPED;
    LOGGER.debug(
        "Connection to %s created with isolation level %s",
        connectionContext.getCoordinatorUri(), connectionContext.getIsolationLevel());
  }

  @Override
  public ITrinoCursor cursor() throws TrinoSQLException {
    LOGGER.debug("public ITrinoCursor cursor()");
    checkOpen();
    TrinoCursor cursor = new TrinoCursor(this);
    cursors.add(cursor);
    return cursor;
  }

  /** Starts a transaction unless in autocommit mode or one is already open. */
  synchronized void beginTransactionIfNeeded() throws TrinoSQLException {
    IsolationLevel isolationLevel = connectionContext.getIsolationLevel();
    if (isolationLevel.isAutocommit() || session.inTransaction()) {
      return;
    }
    LOGGER.debug("Starting transaction with isolation level %s", isolationLevel.getSqlName());
    runToCompletion("START TRANSACTION ISOLATION LEVEL " + isolationLevel.getSqlName());
    if (!session.inTransaction()) {
      throw new TrinoTransactionException("Server did not return a transaction id");
    }
  }

  @Override
  public synchronized void commit() throws TrinoSQLException {
    LOGGER.debug("public void commit()");
    checkOpen();
    String transactionId = session.getTransactionId();
    if (transactionId == null) {
      LOGGER.debug("No transaction is open, commit is a no-op");
      return;
    }
    try {
      runToCompletion("COMMIT");
    } catch (TrinoSQLException e) {
      LOGGER.error(e, "Error %s while committing transaction %s", e.getMessage(), transactionId);
      throw new TrinoTransactionException("Failed to commit transaction " + transactionId, e);
    }
    session.clearTransaction();
  }

  @Override
  public synchronized void rollback() throws TrinoSQLException {
    LOGGER.debug("public void rollback()");
    checkOpen();
    if (!session.inTransaction()) {
      throw new TrinoValidationException(
          "Rollback failed; no transaction is open", TrinoDriverErrorCode.INVALID_STATE);
    }
    rollbackOpenTransaction();
  }

  private void rollbackOpenTransaction() throws TrinoSQLException {
    String transactionId = session.getTransactionId();
    try {
      runToCompletion("ROLLBACK");
    } catch (TrinoSQLException e) {
      LOGGER.error(e, "Error %s while rolling back transaction %s", e.getMessage(), transactionId);
      throw new TrinoTransactionException("Failed to roll back transaction " + transactionId, e);
    }
    session.clearTransaction();
  }

  @Override
  public synchronized void close() {
    LOGGER.debug("public void close()");
    if (closed) {
      return;
    }
    for (TrinoCursor cursor : cursors) {
      cursor.close();
    }
    cursors.clear();
    if (session.inTransaction()) {
      try {
        rollbackOpenTransaction();
      } catch (TrinoSQLException e) {
        LOGGER.warn("Rollback on close failed: %s", e.getMessage());
      }
    }
    closed = true;
    try {
      httpClient.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close HTTP client: %s", e.getMessage());
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public IsolationLevel getIsolationLevel() {
    return connectionContext.getIsolationLevel();
  }

  @Override
  public String getTransactionId() {
    return session.getTransactionId();
  }

  public ITrinoConnectionContext getConnectionContext() {
    return connectionContext;
  }

  /**
   * Whether parameters are bound with {@code PREPARE}/{@code EXECUTE}/{@code DEALLOCATE} instead
   * of {@code EXECUTE IMMEDIATE}. An explicit setting wins; otherwise the server is probed once
   * and the answer kept for the lifetime of the connection.
   */
  boolean useLegacyPreparedStatements() {
    Boolean configured = connectionContext.getLegacyPreparedStatements();
    if (configured != null) {
      return configured;
    }
    synchronized (capabilityLock) {
      if (legacyPreparedStatements == null) {
        legacyPreparedStatements = probeLegacyPreparedStatements();
      }
      return legacyPreparedStatements;
    }
  }

  private boolean probeLegacyPreparedStatements() {
    try {
      runToCompletion(CAPABILITY_PROBE, session.snapshot().withoutTransaction());
      LOGGER.debug("Server supports EXECUTE IMMEDIATE");
      return false;
    } catch (TrinoSQLException e) {
      LOGGER.warn(
          "EXECUTE IMMEDIATE is not supported, falling back to PREPARE and EXECUTE: %s",
          e.getMessage());
      return true;
    }
  }

  TrinoQuery newQuery() {
    return new TrinoQuery(
        httpClient,
        connectionContext.getCoordinatorUri(),
        dataReader,
        typeMappingMode,
        session::apply);
  }

  /** Runs a statement in the current session and discards its rows. */
  TrinoQuery runToCompletion(String sql) throws TrinoSQLException {
    return runToCompletion(sql, session.snapshot());
  }

  private TrinoQuery runToCompletion(String sql, SessionSnapshot snapshot)
      throws TrinoSQLException {
    TrinoQuery query = newQuery();
    query.submit(new StatementRequest(sql, snapshot));
    query.consumeAll();
    return query;
  }

  TrinoSession getSession() {
    return session;
  }

  void removeCursor(TrinoCursor cursor) {
    cursors.remove(cursor);
  }

  private void checkOpen() throws TrinoValidationException {
    if (closed) {
      throw new TrinoValidationException(
          "Connection is closed", TrinoDriverErrorCode.INVALID_STATE);
    }
  }
}
