package com.trino.client.common;

/** Connection parameters accepted in the URL query string or in {@link java.util.Properties}. */
public enum TrinoJdbcUrlParams {
  USER("user"),
  SOURCE("source", TrinoClientConstants.DEFAULT_SOURCE),
  CATALOG("catalog"),
  SCHEMA("schema"),
  TIMEZONE("timezone"),
  LOCALE("locale"),
  SESSION_PROPERTIES("sessionProperties"),
  CLIENT_TAGS("clientTags"),
  CLIENT_INFO("clientInfo"),
  ROLES("roles"),
  EXTRA_CREDENTIALS("extraCredentials"),
  HTTP_HEADERS("httpHeaders"),
  SSL("SSL"),
  SSL_VERIFICATION("sslVerification", "true"),
  MAX_ATTEMPTS("maxAttempts", String.valueOf(TrinoClientConstants.DEFAULT_MAX_ATTEMPTS)),
  MAX_RETRY_ELAPSED_SECONDS(
      "maxRetryElapsedSeconds",
      String.valueOf(TrinoClientConstants.DEFAULT_MAX_RETRY_ELAPSED_SECONDS)),
  REQUEST_TIMEOUT_SECONDS(
      "requestTimeoutSeconds",
      String.valueOf(TrinoClientConstants.DEFAULT_REQUEST_TIMEOUT_SECONDS)),
  ISOLATION_LEVEL("isolationLevel", IsolationLevel.AUTOCOMMIT.name()),
  LEGACY_PREPARED_STATEMENTS("legacyPreparedStatements"),
  LEGACY_PRIMITIVE_TYPES("legacyPrimitiveTypes", "false"),
  ENCODING("encoding"),
  AUTH_TYPE("authType", AuthType.NONE.name()),
  PASSWORD("password"),
  ACCESS_TOKEN("accessToken"),
  KEY_STORE_PATH("keyStorePath"),
  KEY_STORE_PASSWORD("keyStorePassword"),
  KEY_STORE_TYPE("keyStoreType", "PKCS12"),
  KERBEROS_SERVICE_NAME("kerberosServiceName", "trino"),
  KERBEROS_PRINCIPAL("kerberosPrincipal"),
  KERBEROS_DELEGATE("kerberosDelegate", "false"),
  EXTERNAL_AUTHENTICATION_REDIRECT_HANDLERS("externalAuthenticationRedirectHandlers", "OPEN");

  private final String paramName;
  private final String defaultValue;

  TrinoJdbcUrlParams(String paramName) {
    this(paramName, null);
  }

  TrinoJdbcUrlParams(String paramName, String defaultValue) {
    this.paramName = paramName;
    this.defaultValue = defaultValue;
  }

  public String getParamName() {
    return paramName;
  }

  public String getDefaultValue() {
    return defaultValue;
  }
}
