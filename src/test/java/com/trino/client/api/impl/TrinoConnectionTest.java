package com.trino.client.api.impl;

import static com.trino.client.api.impl.ScriptedHttpClient.columns;
import static com.trino.client.api.impl.ScriptedHttpClient.error;
import static org.junit.jupiter.api.Assertions.*;

import com.trino.client.api.ITrinoCursor;
import com.trino.client.common.IsolationLevel;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoTransactionException;
import com.trino.client.exception.TrinoUserErrorException;
import com.trino.client.exception.TrinoValidationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;
import org.apache.http.client.methods.HttpUriRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TrinoConnectionTest {

  private static final String AUTOCOMMIT_URL = "trino://coordinator:8080/hive?user=alice";
  private static final String TRANSACTIONAL_URL =
      "trino://coordinator:8080/hive?user=alice&isolationLevel=READ_COMMITTED";

  private ScriptedHttpClient server;

  @BeforeEach
  void setUp() {
    server = new ScriptedHttpClient();
  }

  private TrinoConnection connect(String url) throws Exception {
    return new TrinoConnection(TrinoConnectionContextFactory.create(url), server);
  }

  private void scriptTransaction(String transactionId) {
    server
        .script("START TRANSACTION")
        .page("")
        .header(TrinoClientConstants.HEADER_STARTED_TRANSACTION, transactionId);
  }

  private static String transactionHeader(HttpUriRequest request) {
    return request.getFirstHeader(TrinoClientConstants.HEADER_TRANSACTION).getValue();
  }

  @Test
  void testAutocommitRunsNoTransactionStatements() throws Exception {
    TrinoConnection connection = connect(AUTOCOMMIT_URL);
    assertEquals(IsolationLevel.AUTOCOMMIT, connection.getIsolationLevel());
    ITrinoCursor cursor = connection.cursor();
    cursor.execute("SELECT 1");
    cursor.execute("SELECT 2");
    connection.commit();
    connection.close();
    assertEquals(Arrays.asList("SELECT 1", "SELECT 2"), server.getStatements());
    assertEquals(
        TrinoClientConstants.NO_TRANSACTION, transactionHeader(server.getRequests().get(0)));
    assertTrue(server.isClosed());
  }

  @Test
  void testTransactionStartsOnceAndRollsBackOnClose() throws Exception {
    scriptTransaction("tx1");
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    ITrinoCursor cursor = connection.cursor();
    cursor.execute("SELECT 1");
    cursor.execute("SELECT 2");
    assertEquals("tx1", connection.getTransactionId());
    connection.close();

    assertEquals(
        Arrays.asList(
            "START TRANSACTION ISOLATION LEVEL READ COMMITTED",
            "SELECT 1",
            "SELECT 2",
            "ROLLBACK"),
        server.getStatements());
    assertEquals(
        TrinoClientConstants.NO_TRANSACTION, transactionHeader(server.getRequests().get(0)));
    assertEquals("tx1", transactionHeader(server.getRequests().get(1)));
    assertEquals("tx1", transactionHeader(server.getRequests().get(3)));
    assertNull(connection.getTransactionId());
    assertTrue(connection.isClosed());
    assertTrue(cursor.isClosed());
  }

  @Test
  void testCommitEndsTransaction() throws Exception {
    scriptTransaction("tx1");
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    ITrinoCursor cursor = connection.cursor();
    cursor.execute("INSERT INTO t VALUES 1");
    connection.commit();
    assertNull(connection.getTransactionId());
    cursor.execute("SELECT 1");
    connection.close();
    assertEquals(
        Arrays.asList(
            "START TRANSACTION ISOLATION LEVEL READ COMMITTED",
            "INSERT INTO t VALUES 1",
            "COMMIT",
            "START TRANSACTION ISOLATION LEVEL READ COMMITTED",
            "SELECT 1",
            "ROLLBACK"),
        server.getStatements());
  }

  @Test
  void testCommitWithoutTransactionIsNoOp() throws Exception {
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    connection.commit();
    assertTrue(server.getRequests().isEmpty());
  }

  @Test
  void testRollbackWithoutTransactionFails() throws Exception {
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    TrinoValidationException e =
        assertThrows(TrinoValidationException.class, connection::rollback);
    assertEquals(TrinoDriverErrorCode.INVALID_STATE, e.getInternalError());
  }

  @Test
  void testExplicitRollback() throws Exception {
    scriptTransaction("tx1");
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    connection.cursor().execute("DELETE FROM t");
    connection.rollback();
    assertNull(connection.getTransactionId());
    connection.close();
    assertEquals("ROLLBACK", server.getStatements().get(2));
    assertEquals(3, server.getStatements().size());
  }

  @Test
  void testMissingTransactionIdIsTransactionError() throws Exception {
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    ITrinoCursor cursor = connection.cursor();
    TrinoTransactionException e =
        assertThrows(TrinoTransactionException.class, () -> cursor.execute("SELECT 1"));
    assertEquals(TrinoDriverErrorCode.TRANSACTION_ERROR, e.getInternalError());
  }

  @Test
  void testFailedCommitKeepsCause() throws Exception {
    scriptTransaction("tx1");
    server.script("COMMIT").page(error("USER_ERROR", "Transaction conflict"));
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    connection.cursor().execute("INSERT INTO t VALUES 1");
    TrinoTransactionException e =
        assertThrows(TrinoTransactionException.class, connection::commit);
    assertTrue(e.getCause() instanceof TrinoUserErrorException);
    assertEquals("tx1", connection.getTransactionId());
  }

  @Test
  void testFailedRollbackOnCloseStillCloses() throws Exception {
    scriptTransaction("tx1");
    server.script("ROLLBACK").page(error("INTERNAL_ERROR", "Coordinator shutting down"));
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    connection.cursor().execute("SELECT 1");
    connection.close();
    assertTrue(connection.isClosed());
    assertTrue(server.isClosed());
  }

  @Test
  void testCloseIsIdempotentAndBlocksNewWork() throws Exception {
    server.script("SELECT n").page(columns("n", "integer")).page("\"data\":[[1]]").page("");
    TrinoConnection connection = connect(AUTOCOMMIT_URL);
    ITrinoCursor cursor = connection.cursor();
    cursor.execute("SELECT n");
    connection.close();
    connection.close();
    assertEquals(1, server.getDeletes().size());
    assertThrows(TrinoValidationException.class, connection::cursor);
    assertThrows(TrinoValidationException.class, () -> cursor.execute("SELECT 1"));
  }

  @Test
  void testCapabilityProbeIsCached() throws Exception {
    TrinoConnection connection = connect(AUTOCOMMIT_URL);
    assertFalse(connection.useLegacyPreparedStatements());
    assertFalse(connection.useLegacyPreparedStatements());
    assertEquals(
        Collections.singletonList("EXECUTE IMMEDIATE 'SELECT 1'"), server.getStatements());
  }

  @Test
  void testProbeRunsOutsideTransaction() throws Exception {
    scriptTransaction("tx1");
    TrinoConnection connection = connect(TRANSACTIONAL_URL);
    connection.cursor().execute("SELECT ?", Collections.singletonList(1));
    assertEquals("EXECUTE IMMEDIATE 'SELECT 1'", server.getStatements().get(1));
    assertEquals(
        TrinoClientConstants.NO_TRANSACTION, transactionHeader(server.getRequests().get(1)));
    assertEquals("tx1", transactionHeader(server.getRequests().get(2)));
  }

  @Test
  void testExplicitSettingSkipsProbe() throws Exception {
    Properties properties = new Properties();
    properties.setProperty("legacyPreparedStatements", "true");
    TrinoConnection connection =
        new TrinoConnection(
            TrinoConnectionContextFactory.create(AUTOCOMMIT_URL, properties), server);
    assertTrue(connection.useLegacyPreparedStatements());
    assertTrue(server.getRequests().isEmpty());
  }

  @Test
  void testOpenFromUrl() throws Exception {
    Properties properties = new Properties();
    properties.setProperty("user", "bob");
    TrinoConnection connection =
        TrinoConnection.open("trino://localhost:8080/tpch/tiny", properties);
    assertEquals("bob", connection.getConnectionContext().getUser());
    assertEquals("tpch", connection.getConnectionContext().getCatalog());
    assertFalse(connection.isClosed());
    connection.close();
    assertTrue(connection.isClosed());
  }
}
