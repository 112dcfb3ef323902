package com.trino.client.api.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableMap;
import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.common.AuthType;
import com.trino.client.common.IsolationLevel;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoValidationException;
import java.net.URI;
import java.util.Arrays;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TrinoConnectionContextTest {

  private static Properties properties(String... keyValues) {
    Properties properties = new Properties();
    for (int i = 0; i < keyValues.length; i += 2) {
      properties.setProperty(keyValues[i], keyValues[i + 1]);
    }
    return properties;
  }

  private static void assertInvalid(String url, Properties properties, String message) {
    TrinoValidationException e =
        assertThrows(
            TrinoValidationException.class,
            () -> TrinoConnectionContextFactory.create(url, properties));
    assertEquals(TrinoDriverErrorCode.INVALID_CONFIGURATION, e.getInternalError());
    assertTrue(e.getMessage().contains(message), e.getMessage());
  }

  @Test
  void testDefaults() throws Exception {
    ITrinoConnectionContext context = TrinoConnectionContextFactory.create("trino://coordinator");
    assertEquals(8080, context.getPort());
    assertFalse(context.isSsl());
    assertEquals(URI.create("http://coordinator:8080"), context.getCoordinatorUri());
    assertEquals("trino-java-client", context.getSource());
    assertEquals(3, context.getMaxAttempts());
    assertEquals(IsolationLevel.AUTOCOMMIT, context.getIsolationLevel());
    assertEquals(AuthType.NONE, context.getAuthType());
    assertNull(context.getLegacyPreparedStatements());
    assertFalse(context.isLegacyPrimitiveTypes());
    assertTrue(context.getEncodings().isEmpty());
    assertTrue(context.isSslVerificationEnabled());
    assertEquals(Arrays.asList("OPEN"), context.getRedirectHandlers());
  }

  @Test
  void testTlsPortImpliesSsl() throws Exception {
    ITrinoConnectionContext context = TrinoConnectionContextFactory.create("trino://c:443");
    assertTrue(context.isSsl());
    assertEquals("https", context.getScheme());
    ITrinoConnectionContext explicit =
        TrinoConnectionContextFactory.create("trino://c?SSL=true");
    assertEquals(443, explicit.getPort());
    assertFalse(TrinoConnectionContextFactory.create("trino://c:443?SSL=false").isSsl());
  }

  @Test
  void testCatalogAndSchemaFromPath() throws Exception {
    ITrinoConnectionContext context =
        TrinoConnectionContextFactory.create("trino://c:8080/hive/web%20logs?user=alice");
    assertEquals("hive", context.getCatalog());
    assertEquals("web logs", context.getSchema());
    assertEquals("alice", context.getUser());
  }

  @Test
  void testPropertiesOverrideUrl() throws Exception {
    ITrinoConnectionContext context =
        TrinoConnectionContextFactory.create(
            "trino://c:8080/hive?user=alice&maxAttempts=5",
            properties("user", "bob", "catalog", "iceberg"));
    assertEquals("bob", context.getUser());
    assertEquals("iceberg", context.getCatalog());
    assertEquals(5, context.getMaxAttempts());
  }

  @Test
  void testParameterNamesAreCaseInsensitive() throws Exception {
    ITrinoConnectionContext context =
        TrinoConnectionContextFactory.create(
            "trino://c:8080?ISOLATIONLEVEL=serializable&LegacyPreparedStatements=TRUE");
    assertEquals(IsolationLevel.SERIALIZABLE, context.getIsolationLevel());
    assertTrue(context.getLegacyPreparedStatements());
  }

  @Test
  void testStructuredParameters() throws Exception {
    ITrinoConnectionContext context =
        TrinoConnectionContextFactory.create(
            "trino://c:8080",
            properties(
                "sessionProperties", "query_max_run_time:2h;spill_enabled:true",
                "clientTags", "etl, nightly",
                "encoding", "json+zstd,json"));
    assertEquals(
        ImmutableMap.of("query_max_run_time", "2h", "spill_enabled", "true"),
        context.getSessionProperties());
    assertEquals(Arrays.asList("etl", "nightly"), context.getClientTags());
    assertEquals(Arrays.asList("json+zstd", "json"), context.getEncodings());
  }

  @Test
  void testAuthenticationRequiresSsl() {
    assertInvalid(
        "trino://c:8080",
        properties("authType", "BASIC", "user", "a", "password", "p"),
        "cannot use authentication with HTTP");
  }

  @Test
  void testBasicNeedsPassword() {
    assertInvalid(
        "trino://c:443", properties("authType", "basic", "user", "a"), "user and password");
  }

  @Test
  void testReservedHeaderCannotBeOverridden() {
    assertInvalid(
        "trino://c:8080",
        properties("httpHeaders", "x-trino-user:mallory"),
        "cannot override reserved HTTP header");
  }

  @ParameterizedTest
  @ValueSource(strings = {"bad key:v", "kéy:v"})
  void testInvalidExtraCredentialKeys(String value) {
    assertInvalid("trino://c:8080", properties("extraCredentials", value), "extra credential");
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "-1", "many"})
  void testInvalidMaxAttempts(String value) {
    assertInvalid("trino://c:8080", properties("maxAttempts", value), "maxAttempts");
  }

  @Test
  void testUnknownEnumValue() {
    assertInvalid("trino://c:8080", properties("isolationLevel", "SNAPSHOT"), "isolationLevel");
  }

  @Test
  void testMalformedEntries() {
    assertInvalid("trino://c:8080", properties("roles", "admin"), "roles");
  }

  @Test
  void testInvalidUrls() {
    assertInvalid("jdbc:trino://c:8080", null, "expected trino:// prefix");
    assertInvalid("trino://c:8080/a/b/c", null, "too many path segments");
    assertInvalid("trino://c:8080?novalue", null, "malformed parameter");
    assertInvalid("trino:///hive", null, "must contain a host");
  }
}
