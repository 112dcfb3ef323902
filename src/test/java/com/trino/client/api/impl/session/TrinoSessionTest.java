package com.trino.client.api.impl.session;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.trino.client.api.impl.TrinoConnectionContextFactory;
import com.trino.client.dbclient.TrinoHttpResponse;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TrinoSessionTest {

  private TrinoSession session;

  @BeforeEach
  void setUp() throws Exception {
    Properties properties = new Properties();
    properties.setProperty("user", "alice");
    properties.setProperty(
        "sessionProperties", "query_max_run_time:1h;join_distribution_type:BROADCAST");
    properties.setProperty("roles", "hive:admin;system:all");
    properties.setProperty("clientTags", "etl, nightly");
    properties.setProperty("extraCredentials", "s3.key:a b");
    properties.setProperty("httpHeaders", "X-Request-Origin:tests");
    properties.setProperty("encoding", "json+lz4,json");
    session =
        new TrinoSession(
            TrinoConnectionContextFactory.create(
                "trino://coordinator:8080/hive/default", properties));
  }

  private static TrinoHttpResponse response(String... headerPairs) {
    ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
    for (int i = 0; i < headerPairs.length; i += 2) {
      headers.put(headerPairs[i], headerPairs[i + 1]);
    }
    return new TrinoHttpResponse(200, headers.build(), new byte[0]);
  }

  @Test
  void testInitialHeaders() {
    Map<String, String> headers = session.snapshot().toHeaders();

    assertEquals("X-Request-Origin", ImmutableList.copyOf(headers.keySet()).get(0));
    assertEquals("alice", headers.get("X-Trino-User"));
    assertEquals("trino-java-client", headers.get("X-Trino-Source"));
    assertEquals("hive", headers.get("X-Trino-Catalog"));
    assertEquals("default", headers.get("X-Trino-Schema"));
    assertEquals(
        "query_max_run_time=1h,join_distribution_type=BROADCAST",
        headers.get("X-Trino-Session"));
    assertEquals("hive=ROLE{admin},system=ALL", headers.get("X-Trino-Role"));
    assertEquals("etl,nightly", headers.get("X-Trino-Client-Tags"));
    assertEquals("s3.key=a+b", headers.get("X-Trino-Extra-Credential"));
    assertEquals("json+lz4,json", headers.get("X-Trino-Query-Data-Encoding"));
    assertEquals("NONE", headers.get("X-Trino-Transaction-Id"));
    assertFalse(headers.containsKey("X-Trino-Prepared-Statement"));
  }

  @Test
  void testResponseHeadersUpdateSession() {
    session.apply(
        SessionUpdates.fromResponse(
            response(
                "X-Trino-Set-Catalog", "iceberg",
                "X-Trino-Set-Schema", "sales",
                "X-Trino-Set-Session", "time_zone=Europe%2FParis,label=a%20b",
                "X-Trino-Clear-Session", "query_max_run_time",
                "X-Trino-Set-Role", "iceberg=ROLE%7Banalyst%7D")));

    assertEquals("iceberg", session.getCatalog());
    assertEquals("sales", session.getSchema());
    assertEquals("Europe/Paris", session.getProperties().get("time_zone"));
    assertFalse(session.getProperties().containsKey("query_max_run_time"));
    assertEquals("ROLE{analyst}", session.getRoles().get("iceberg"));
    Map<String, String> headers = session.snapshot().toHeaders();
    assertEquals(
        "join_distribution_type=BROADCAST,time_zone=Europe%2FParis,label=a%20b",
        headers.get("X-Trino-Session"));
  }

  @Test
  void testPreparedStatementsAreTracked() {
    session.apply(
        SessionUpdates.fromResponse(
            response("X-Trino-Added-Prepare", "st_1=SELECT+*+FROM+t+WHERE+x+%3D+%3F")));

    assertEquals("SELECT * FROM t WHERE x = ?", session.getPreparedStatements().get("st_1"));
    assertEquals(
        "st_1=SELECT+*+FROM+t+WHERE+x+%3D+%3F",
        session.snapshot().toHeaders().get("X-Trino-Prepared-Statement"));

    session.apply(SessionUpdates.fromResponse(response("X-Trino-Deallocated-Prepare", "st_1")));

    assertTrue(session.getPreparedStatements().isEmpty());
  }

  @Test
  void testTransactionLifecycle() {
    session.apply(
        SessionUpdates.fromResponse(response("X-Trino-Started-Transaction-Id", "tx-42")));

    assertTrue(session.inTransaction());
    SessionSnapshot snapshot = session.snapshot();
    assertEquals("tx-42", snapshot.toHeaders().get("X-Trino-Transaction-Id"));
    assertEquals("NONE", snapshot.withoutTransaction().toHeaders().get("X-Trino-Transaction-Id"));

    session.apply(SessionUpdates.fromResponse(response("X-Trino-Clear-Transaction-Id", "true")));

    assertFalse(session.inTransaction());
    assertEquals("tx-42", snapshot.getTransactionId());
  }

  @Test
  void testStartedTransactionNoneIsIgnored() {
    SessionUpdates updates =
        SessionUpdates.fromResponse(response("X-Trino-Started-Transaction-Id", "NONE"));

    assertTrue(updates.isEmpty());
    session.apply(updates);
    assertNull(session.getTransactionId());
  }

  @Test
  void testSnapshotIsNotAffectedByLaterUpdates() {
    SessionSnapshot before = session.snapshot();

    session.apply(SessionUpdates.fromResponse(response("X-Trino-Set-Catalog", "iceberg")));

    assertEquals("hive", before.getCatalog());
    assertEquals("iceberg", session.snapshot().getCatalog());
  }

  @Test
  void testRoleFormatting() {
    assertEquals("ALL", TrinoSession.formatRole("all"));
    assertEquals("NONE", TrinoSession.formatRole("None"));
    assertEquals("ROLE{admin}", TrinoSession.formatRole("admin"));
  }
}
