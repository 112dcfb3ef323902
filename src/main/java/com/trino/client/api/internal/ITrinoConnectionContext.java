package com.trino.client.api.internal;

import com.trino.client.common.AuthType;
import com.trino.client.common.IsolationLevel;
import java.net.URI;
import java.util.List;
import java.util.Map;

/** Resolved connection settings. Implementations are immutable. */
public interface ITrinoConnectionContext {

  String getHost();

  int getPort();

  /** {@code http} or {@code https}. */
  String getScheme();

  boolean isSsl();

  boolean isSslVerificationEnabled();

  /** {@code scheme://host:port} of the coordinator. */
  URI getCoordinatorUri();

  String getUser();

  String getSource();

  String getCatalog();

  String getSchema();

  String getTimeZone();

  String getLocale();

  String getClientInfo();

  Map<String, String> getSessionProperties();

  List<String> getClientTags();

  /** Catalog to role name; the special values {@code ALL} and {@code NONE} are kept verbatim. */
  Map<String, String> getRoles();

  Map<String, String> getExtraCredentials();

  Map<String, String> getHttpHeaders();

  int getMaxAttempts();

  int getMaxRetryElapsedSeconds();

  int getRequestTimeoutSeconds();

  IsolationLevel getIsolationLevel();

  /** Explicit prepared statement mode, or null when the server should be probed. */
  Boolean getLegacyPreparedStatements();

  boolean isLegacyPrimitiveTypes();

  /** Spooling encodings to request, in order of preference. Empty disables spooling. */
  List<String> getEncodings();

  AuthType getAuthType();

  String getPassword();

  String getAccessToken();

  String getKeyStorePath();

  String getKeyStorePassword();

  String getKeyStoreType();

  String getKerberosServiceName();

  String getKerberosPrincipal();

  boolean isKerberosDelegate();

  List<String> getRedirectHandlers();
}
