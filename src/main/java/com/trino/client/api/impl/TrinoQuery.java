package com.trino.client.api.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.trino.client.api.impl.converters.RowDecoder;
import com.trino.client.api.impl.converters.TypeMappingMode;
import com.trino.client.api.impl.session.SessionUpdates;
import com.trino.client.api.impl.spooling.QueryDataReader;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoQueryException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.exception.TrinoValidationException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import com.trino.client.model.core.Column;
import com.trino.client.model.core.QueryResults;
import com.trino.client.model.core.StatementStats;
import com.trino.client.model.core.Warning;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;

/**
 * Execution of one statement: submission, polling of {@code nextUri}, and the buffer of decoded
 * rows not yet handed to the caller.
 *
 * <p>Columns are fixed by the first page that carries them. A server error ends the query but is
 * raised only once the rows received before it have been consumed, and only once. Cancellation
 * is best effort and never raises.
 *
 * <p>An instance is driven by one caller at a time; only {@link #cancel()} may be called from
 * another thread.
 */
public class TrinoQuery {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(TrinoQuery.class);

  private final ITrinoHttpClient httpClient;
  private final URI coordinatorUri;
  private final QueryDataReader dataReader;
  private final TypeMappingMode typeMappingMode;
  private final Consumer<SessionUpdates> sessionUpdateListener;

  private volatile QueryState state = QueryState.CREATED;
  private volatile String nextUri;
  private volatile String infoUri;
  private volatile String queryId;
  private List<ColumnDescription> columns;
  private RowDecoder rowDecoder;
  private StatementStats stats;
  private List<Warning> warnings = ImmutableList.of();
  private String updateType;
  private Long updateCount;
  private final Deque<List<Object>> pendingRows = new ArrayDeque<>();
  private TrinoSQLException failure;

  public TrinoQuery(
      ITrinoHttpClient httpClient,
      URI coordinatorUri,
      QueryDataReader dataReader,
      TypeMappingMode typeMappingMode,
      Consumer<SessionUpdates> sessionUpdateListener) {
    this.httpClient = checkNotNull(httpClient, "httpClient is null");
    this.coordinatorUri = checkNotNull(coordinatorUri, "coordinatorUri is null");
    this.dataReader = checkNotNull(dataReader, "dataReader is null");
    this.typeMappingMode = checkNotNull(typeMappingMode, "typeMappingMode is null");
    this.sessionUpdateListener = checkNotNull(sessionUpdateListener, "listener is null");
  }

  /** Sends the statement. Returns once the first response has been processed. */
  public void submit(StatementRequest request) throws TrinoSQLException {
    if (state == QueryState.CANCELLED) {
      throw new TrinoValidationException(
          "Query has been cancelled", TrinoDriverErrorCode.INVALID_STATE);
    }
    if (state != QueryState.CREATED) {
      throw new TrinoValidationException(
          "Query has already been submitted", TrinoDriverErrorCode.INVALID_STATE);
    }
    LOGGER.debug("Submitting statement: %s", request.getSql());
    state = QueryState.RUNNING;
    process(send(request.toHttpPost(coordinatorUri)));
  }

  /**
   * Polls {@code nextUri} once and buffers the rows of the page. A no-op once the last page has
   * arrived.
   *
   * @return the state after the poll
   */
  public QueryState advance() throws TrinoSQLException {
    String uri = nextUri;
    if (state.isTerminal() || uri == null) {
      return state;
    }
    process(send(new HttpGet(uri)));
    return state;
  }

  /**
   * Next row of the result, polling as many pages as needed.
   *
   * @return the row, or null once the result is exhausted or the query was cancelled
   * @throws TrinoSQLException the recorded server error, once all rows before it are consumed
   */
  public List<Object> nextRow() throws TrinoSQLException {
    while (true) {
      if (state == QueryState.CANCELLED) {
        pendingRows.clear();
        raiseFailureIfRecorded();
        return null;
      }
      List<Object> row = pendingRows.poll();
      if (row != null) {
        if (pendingRows.isEmpty() && state == QueryState.FINISHING) {
          state = QueryState.FINISHED;
        }
        return row;
      }
      raiseFailureIfRecorded();
      if (isComplete()) {
        return null;
      }
      advance();
    }
  }

  /**
   * Polls until a row is buffered or the query ends. A failure is raised here when no row
   * precedes it.
   */
  public void awaitFirstRow() throws TrinoSQLException {
    while (pendingRows.isEmpty() && !isComplete()) {
      advance();
    }
    if (pendingRows.isEmpty()) {
      raiseFailureIfRecorded();
    }
  }

  /** Reads and discards every remaining row, raising the query's error if it has one. */
  public void consumeAll() throws TrinoSQLException {
    List<Object> row = nextRow();
    while (row != null) {
      row = nextRow();
    }
  }

  /**
   * Asks the coordinator to stop the query, with a DELETE on {@code nextUri} or, once there is
   * none, on {@code infoUri}. Failures are logged only; the query is cancelled locally either way.
   */
  public void cancel() {
    QueryState current = state;
    if (current == QueryState.FINISHED || current == QueryState.FAILED) {
      return;
    }
    String target = nextUri != null ? nextUri : infoUri;
    state = QueryState.CANCELLED;
    if (current == QueryState.CREATED || current == QueryState.FINISHING || target == null) {
      return;
    }
    LOGGER.debug("Cancelling query %s", queryId);
    deleteQuietly(target);
  }

  private TrinoHttpResponse send(HttpUriRequest request) throws TrinoSQLException {
    try {
      return httpClient.execute(request);
    } catch (TrinoSQLException e) {
      state = QueryState.FAILED;
      nextUri = null;
      throw e;
    }
  }

  private void process(TrinoHttpResponse response) throws TrinoSQLException {
    QueryResults results = parse(response);
    if (state == QueryState.CANCELLED) {
      LOGGER.debug("Discarding response for cancelled query %s", results.getId());
      return;
    }
    try {
      apply(response, results);
    } catch (TrinoSQLException e) {
      String abandoned = results.getNextUri();
      state = QueryState.FAILED;
      nextUri = null;
      if (abandoned != null) {
        deleteQuietly(abandoned);
      }
      throw e;
    }
  }

  private QueryResults parse(TrinoHttpResponse response) throws TrinoSQLException {
    QueryResults results;
    try {
      results = JsonUtil.getMapper().readValue(response.getBody(), QueryResults.class);
    } catch (IOException e) {
      state = QueryState.FAILED;
      nextUri = null;
      throw new TrinoProtocolException("Malformed statement response: " + e.getMessage(), e);
    }
    if (results == null || results.getId() == null) {
      state = QueryState.FAILED;
      nextUri = null;
      throw new TrinoProtocolException("Statement response does not carry a query id");
    }
    return results;
  }

  private void apply(TrinoHttpResponse response, QueryResults results)
      throws TrinoSQLException {
    if (queryId == null) {
      queryId = results.getId();
    }
    if (results.getInfoUri() != null) {
      infoUri = results.getInfoUri();
    }
    SessionUpdates updates =
        results.getError() == null ? SessionUpdates.fromResponse(response) : null;
    mergeColumns(results.getColumns());
    JsonNode rows = dataReader.read(results.getData());
    List<List<Object>> decoded = null;
    if (rows != null && rows.size() > 0) {
      if (rowDecoder == null) {
        throw new TrinoProtocolException("Query " + queryId + " returned data before columns");
      }
      decoded = rowDecoder.decodeRows(rows);
    }
    // session changes only take effect once the whole page has been accepted
    if (updates != null) {
      sessionUpdateListener.accept(updates);
    }
    if (decoded != null) {
      pendingRows.addAll(decoded);
    }
    if (results.getStats() != null) {
      stats = results.getStats();
    }
    if (results.getWarnings() != null) {
      warnings = ImmutableList.copyOf(results.getWarnings());
    }
    if (results.getUpdateType() != null) {
      updateType = results.getUpdateType();
    }
    if (results.getUpdateCount() != null) {
      updateCount = results.getUpdateCount();
    }

    if (results.getError() != null) {
      failure = TrinoQueryException.of(results.getError(), queryId);
      nextUri = null;
      state = QueryState.FAILED;
      LOGGER.debug("Query %s failed: %s", queryId, failure.getMessage());
    } else if (results.getNextUri() == null) {
      nextUri = null;
      state = pendingRows.isEmpty() ? QueryState.FINISHED : QueryState.FINISHING;
    } else {
      nextUri = results.getNextUri();
    }
  }

  private void mergeColumns(List<Column> received) throws TrinoSQLException {
    if (received == null) {
      return;
    }
    List<ColumnDescription> descriptions = new ArrayList<>(received.size());
    for (Column column : received) {
      descriptions.add(ColumnDescription.fromColumn(column));
    }
    if (columns == null) {
      columns = ImmutableList.copyOf(descriptions);
      rowDecoder = new RowDecoder(columns, typeMappingMode);
    } else if (!columns.equals(descriptions)) {
      throw new TrinoProtocolException(
          String.format(
              "Columns of query %s changed from %s to %s", queryId, columns, descriptions));
    }
  }

  private void raiseFailureIfRecorded() throws TrinoSQLException {
    TrinoSQLException recorded = failure;
    if (recorded != null) {
      failure = null;
      throw recorded;
    }
  }

  private boolean isComplete() {
    return state.isTerminal() || nextUri == null && state != QueryState.CREATED;
  }

  private void deleteQuietly(String uri) {
    try {
      TrinoHttpResponse response = httpClient.executeOnce(new HttpDelete(uri));
      LOGGER.debug("Cancel request for query %s returned %d", queryId, response.getStatusCode());
    } catch (TrinoSQLException e) {
      LOGGER.warn("Failed to cancel query %s: %s", queryId, e.getMessage());
    }
  }

  public QueryState getState() {
    return state;
  }

  public String getQueryId() {
    return queryId;
  }

  public String getInfoUri() {
    return infoUri;
  }

  public String getNextUri() {
    return nextUri;
  }

  /** Columns of the result, or null while none have been received. */
  public List<ColumnDescription> getColumns() {
    return columns;
  }

  public StatementStats getStats() {
    return stats;
  }

  public List<Warning> getWarnings() {
    return warnings;
  }

  public String getUpdateType() {
    return updateType;
  }

  /** Rows affected, or null when the server did not report a count. */
  public Long getUpdateCount() {
    return updateCount;
  }

  public boolean isCancelled() {
    return state == QueryState.CANCELLED;
  }
}
