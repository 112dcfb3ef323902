package com.trino.client.api.impl;

import static com.trino.client.common.TrinoJdbcUrlParams.*;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.common.AuthType;
import com.trino.client.common.IsolationLevel;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.common.TrinoJdbcUrlParams;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoValidationException;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/** Immutable connection settings resolved from a URL and connection properties. */
public class TrinoConnectionContext implements ITrinoConnectionContext {

  private static final Pattern EXTRA_CREDENTIAL_KEY = Pattern.compile("^\\S[^\\s=]*$");
  private static final Splitter ENTRY_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final String host;
  private final int port;
  private final boolean ssl;
  private final Map<String, String> parameters;

  private final Map<String, String> sessionProperties;
  private final List<String> clientTags;
  private final Map<String, String> roles;
  private final Map<String, String> extraCredentials;
  private final Map<String, String> httpHeaders;
  private final AuthType authType;
  private final IsolationLevel isolationLevel;

  /**
   * @param host coordinator host
   * @param port coordinator port, or -1 for the default
   * @param parameters merged URL and property values, keyed case-insensitively
   */
  TrinoConnectionContext(String host, int port, Map<String, String> parameters)
      throws TrinoValidationException {
    if (Strings.isNullOrEmpty(host)) {
      throw new TrinoValidationException(
          "Connection URL must contain a host", TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
    this.host = host;
    Map<String, String> params = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    params.putAll(parameters);
    this.parameters = params;

    String sslValue = params.get(SSL.getParamName());
    if (port < 0) {
      port =
          Boolean.parseBoolean(sslValue)
              ? TrinoClientConstants.DEFAULT_TLS_PORT
              : TrinoClientConstants.DEFAULT_PORT;
    }
    this.port = port;
    this.ssl =
        sslValue == null ? port == TrinoClientConstants.DEFAULT_TLS_PORT : parseBoolean(SSL);

    this.sessionProperties = parseEntries(SESSION_PROPERTIES);
    this.clientTags = parseList(CLIENT_TAGS);
    this.roles = parseEntries(ROLES);
    this.extraCredentials = parseEntries(EXTRA_CREDENTIALS);
    this.httpHeaders = parseEntries(HTTP_HEADERS);
    this.authType = parseEnum(AuthType.class, AUTH_TYPE);
    this.isolationLevel = parseEnum(IsolationLevel.class, ISOLATION_LEVEL);
    validate();
  }

  private void validate() throws TrinoValidationException {
    if (authType != AuthType.NONE && !ssl) {
      throw new TrinoValidationException(
          "cannot use authentication with HTTP", TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
    for (String header : httpHeaders.keySet()) {
      for (String reserved : TrinoClientConstants.RESERVED_HEADERS) {
        if (reserved.equalsIgnoreCase(header)) {
          throw new TrinoValidationException(
              "cannot override reserved HTTP header " + header,
              TrinoDriverErrorCode.INVALID_CONFIGURATION);
        }
      }
    }
    for (String key : extraCredentials.keySet()) {
      if (!EXTRA_CREDENTIAL_KEY.matcher(key).matches()) {
        throw new TrinoValidationException(
            String.format("whitespace or '=' are disallowed in extra credential '%s'", key),
            TrinoDriverErrorCode.INVALID_CONFIGURATION);
      }
      if (!CharMatcher.ascii().matchesAllOf(key)) {
        throw new TrinoValidationException(
            String.format("only ASCII characters are allowed in extra credential '%s'", key),
            TrinoDriverErrorCode.INVALID_CONFIGURATION);
      }
    }
    for (TrinoJdbcUrlParams param :
        new TrinoJdbcUrlParams[] {
          MAX_ATTEMPTS, MAX_RETRY_ELAPSED_SECONDS, REQUEST_TIMEOUT_SECONDS
        }) {
      String value = getParameter(param);
      try {
        if (Integer.parseInt(value.trim()) < 1) {
          throw invalidValue(param, value);
        }
      } catch (NumberFormatException e) {
        throw invalidValue(param, value);
      }
    }
    if (authType == AuthType.BASIC && (getUser() == null || getPassword() == null)) {
      throw new TrinoValidationException(
          "user and password are required for BASIC authentication",
          TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
  }

  @VisibleForTesting
  String getParameter(TrinoJdbcUrlParams param) {
    String value = parameters.get(param.getParamName());
    return value == null ? param.getDefaultValue() : value;
  }

  private boolean parseBoolean(TrinoJdbcUrlParams param) throws TrinoValidationException {
    String value = getParameter(param);
    if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
      return true;
    }
    if (value == null || "false".equalsIgnoreCase(value) || "0".equals(value)) {
      return false;
    }
    throw invalidValue(param, value);
  }

  private int parseInt(TrinoJdbcUrlParams param) {
    return Integer.parseInt(getParameter(param).trim());
  }

  private <E extends Enum<E>> E parseEnum(Class<E> type, TrinoJdbcUrlParams param)
      throws TrinoValidationException {
    String value = getParameter(param);
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw invalidValue(param, value);
    }
  }

  private Map<String, String> parseEntries(TrinoJdbcUrlParams param)
      throws TrinoValidationException {
    String value = getParameter(param);
    if (Strings.isNullOrEmpty(value)) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (String entry : ENTRY_SPLITTER.split(value)) {
      int separator = entry.indexOf(':');
      if (separator <= 0) {
        throw invalidValue(param, value);
      }
      builder.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
    }
    try {
      return builder.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new TrinoValidationException(
          String.format("Duplicate key in %s: %s", param.getParamName(), value), e);
    }
  }

  private List<String> parseList(TrinoJdbcUrlParams param) {
    String value = getParameter(param);
    return Strings.isNullOrEmpty(value)
        ? ImmutableList.of()
        : ImmutableList.copyOf(LIST_SPLITTER.split(value));
  }

  private static TrinoValidationException invalidValue(TrinoJdbcUrlParams param, String value) {
    return new TrinoValidationException(
        String.format("Invalid value for %s: %s", param.getParamName(), value),
        TrinoDriverErrorCode.INVALID_CONFIGURATION);
  }

  @Override
  public String getHost() {
    return host;
  }

  @Override
  public int getPort() {
    return port;
  }

  @Override
  public String getScheme() {
    return ssl ? TrinoClientConstants.HTTPS : TrinoClientConstants.HTTP;
  }

  @Override
  public boolean isSsl() {
    return ssl;
  }

  @Override
  public boolean isSslVerificationEnabled() {
    return !"false".equalsIgnoreCase(getParameter(SSL_VERIFICATION));
  }

  @Override
  public URI getCoordinatorUri() {
    return URI.create(String.format("%s://%s:%d", getScheme(), host, port));
  }

  @Override
  public String getUser() {
    return getParameter(USER);
  }

  @Override
  public String getSource() {
    return getParameter(SOURCE);
  }

  @Override
  public String getCatalog() {
    return getParameter(CATALOG);
  }

  @Override
  public String getSchema() {
    return getParameter(SCHEMA);
  }

  @Override
  public String getTimeZone() {
    return getParameter(TIMEZONE);
  }

  @Override
  public String getLocale() {
    return getParameter(LOCALE);
  }

  @Override
  public String getClientInfo() {
    return getParameter(CLIENT_INFO);
  }

  @Override
  public Map<String, String> getSessionProperties() {
    return sessionProperties;
  }

  @Override
  public List<String> getClientTags() {
    return clientTags;
  }

  @Override
  public Map<String, String> getRoles() {
    return roles;
  }

  @Override
  public Map<String, String> getExtraCredentials() {
    return extraCredentials;
  }

  @Override
  public Map<String, String> getHttpHeaders() {
    return httpHeaders;
  }

  @Override
  public int getMaxAttempts() {
    return parseInt(MAX_ATTEMPTS);
  }

  @Override
  public int getMaxRetryElapsedSeconds() {
    return parseInt(MAX_RETRY_ELAPSED_SECONDS);
  }

  @Override
  public int getRequestTimeoutSeconds() {
    return parseInt(REQUEST_TIMEOUT_SECONDS);
  }

  @Override
  public IsolationLevel getIsolationLevel() {
    return isolationLevel;
  }

  @Override
  public Boolean getLegacyPreparedStatements() {
    String value = getParameter(LEGACY_PREPARED_STATEMENTS);
    return value == null ? null : Boolean.parseBoolean(value.trim());
  }

  @Override
  public boolean isLegacyPrimitiveTypes() {
    return Boolean.parseBoolean(getParameter(LEGACY_PRIMITIVE_TYPES));
  }

  @Override
  public List<String> getEncodings() {
    return parseList(ENCODING);
  }

  @Override
  public AuthType getAuthType() {
    return authType;
  }

  @Override
  public String getPassword() {
    return getParameter(PASSWORD);
  }

  @Override
  public String getAccessToken() {
    return getParameter(ACCESS_TOKEN);
  }

  @Override
  public String getKeyStorePath() {
    return getParameter(KEY_STORE_PATH);
  }

  @Override
  public String getKeyStorePassword() {
    return getParameter(KEY_STORE_PASSWORD);
  }

  @Override
  public String getKeyStoreType() {
    return getParameter(KEY_STORE_TYPE);
  }

  @Override
  public String getKerberosServiceName() {
    return getParameter(KERBEROS_SERVICE_NAME);
  }

  @Override
  public String getKerberosPrincipal() {
    return getParameter(KERBEROS_PRINCIPAL);
  }

  @Override
  public boolean isKerberosDelegate() {
    return Boolean.parseBoolean(getParameter(KERBEROS_DELEGATE));
  }

  @Override
  public List<String> getRedirectHandlers() {
    return parseList(EXTERNAL_AUTHENTICATION_REDIRECT_HANDLERS);
  }
}
