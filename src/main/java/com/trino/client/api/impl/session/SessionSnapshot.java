package com.trino.client.api.impl.session;

import static com.trino.client.common.TrinoClientConstants.*;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.trino.client.common.util.HeaderValues;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the session state taken for one request. Renders the request headers that
 * carry the session to the coordinator.
 */
public final class SessionSnapshot {

  private static final Joiner COMMA = Joiner.on(',');

  private final String user;
  private final String source;
  private final String catalog;
  private final String schema;
  private final String timeZone;
  private final String locale;
  private final String clientInfo;
  private final Map<String, String> properties;
  private final List<String> clientTags;
  private final Map<String, String> roles;
  private final Map<String, String> extraCredentials;
  private final Map<String, String> customHeaders;
  private final Map<String, String> preparedStatements;
  private final List<String> encodings;
  private final String transactionId;

  SessionSnapshot(
      String user,
      String source,
      String catalog,
      String schema,
      String timeZone,
      String locale,
      String clientInfo,
      Map<String, String> properties,
      List<String> clientTags,
      Map<String, String> roles,
      Map<String, String> extraCredentials,
      Map<String, String> customHeaders,
      Map<String, String> preparedStatements,
      List<String> encodings,
      String transactionId) {
    this.user = user;
    this.source = source;
    this.catalog = catalog;
    this.schema = schema;
    this.timeZone = timeZone;
    this.locale = locale;
    this.clientInfo = clientInfo;
    this.properties = ImmutableMap.copyOf(properties);
    this.clientTags = ImmutableList.copyOf(clientTags);
    this.roles = ImmutableMap.copyOf(roles);
    this.extraCredentials = ImmutableMap.copyOf(extraCredentials);
    this.customHeaders = ImmutableMap.copyOf(customHeaders);
    this.preparedStatements = ImmutableMap.copyOf(preparedStatements);
    this.encodings = ImmutableList.copyOf(encodings);
    this.transactionId = transactionId;
  }

  /** Same session in autocommit mode, for statements that must not join the open transaction. */
  public SessionSnapshot withoutTransaction() {
    return new SessionSnapshot(
        user,
        source,
        catalog,
        schema,
        timeZone,
        locale,
        clientInfo,
        properties,
        clientTags,
        roles,
        extraCredentials,
        customHeaders,
        preparedStatements,
        encodings,
        null);
  }

  /**
   * Headers to send with a statement request, in a stable order. Custom headers come first so the
   * protocol headers are never shadowed.
   */
  public Map<String, String> toHeaders() {
    Map<String, String> headers = new LinkedHashMap<>(customHeaders);
    putIfPresent(headers, HEADER_USER, user);
    putIfPresent(headers, HEADER_SOURCE, source);
    putIfPresent(headers, HEADER_CATALOG, catalog);
    putIfPresent(headers, HEADER_SCHEMA, schema);
    putIfPresent(headers, HEADER_TIME_ZONE, timeZone);
    putIfPresent(headers, HEADER_LANGUAGE, locale);
    putIfPresent(headers, HEADER_CLIENT_INFO, clientInfo);
    if (!clientTags.isEmpty()) {
      headers.put(HEADER_CLIENT_TAGS, COMMA.join(clientTags));
    }
    if (!properties.isEmpty()) {
      headers.put(HEADER_SESSION, joinEncoded(properties, ",", true));
    }
    if (!roles.isEmpty()) {
      headers.put(HEADER_ROLE, joinRoles());
    }
    if (!extraCredentials.isEmpty()) {
      headers.put(HEADER_EXTRA_CREDENTIAL, joinEncoded(extraCredentials, ", ", false));
    }
    if (!preparedStatements.isEmpty()) {
      headers.put(HEADER_PREPARED_STATEMENT, joinEncoded(preparedStatements, ",", false));
    }
    if (!encodings.isEmpty()) {
      headers.put(HEADER_QUERY_DATA_ENCODING, COMMA.join(encodings));
    }
    headers.put(HEADER_TRANSACTION, transactionId == null ? NO_TRANSACTION : transactionId);
    return headers;
  }

  private String joinRoles() {
    StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, String> role : roles.entrySet()) {
      if (builder.length() > 0) {
        builder.append(',');
      }
      builder.append(role.getKey()).append('=').append(role.getValue());
    }
    return builder.toString();
  }

  private static String joinEncoded(
      Map<String, String> values, String separator, boolean percentEncoding) {
    StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (builder.length() > 0) {
        builder.append(separator);
      }
      String value = entry.getValue() == null ? "" : entry.getValue();
      builder
          .append(entry.getKey())
          .append('=')
          .append(
              percentEncoding ? HeaderValues.percentEncode(value) : HeaderValues.urlEncode(value));
    }
    return builder.toString();
  }

  private static void putIfPresent(Map<String, String> headers, String name, String value) {
    if (value != null) {
      headers.put(name, value);
    }
  }

  public String getUser() {
    return user;
  }

  public String getCatalog() {
    return catalog;
  }

  public String getSchema() {
    return schema;
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  public Map<String, String> getRoles() {
    return roles;
  }

  public Map<String, String> getPreparedStatements() {
    return preparedStatements;
  }

  public List<String> getEncodings() {
    return encodings;
  }

  /** Current transaction id, or null in autocommit mode. */
  public String getTransactionId() {
    return transactionId;
  }

  @Override
  public String toString() {
    // credentials and custom header values are left out
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("user", user)
        .add("catalog", catalog)
        .add("schema", schema)
        .add("properties", properties)
        .add("roles", roles)
        .add("preparedStatements", preparedStatements.keySet())
        .add("transactionId", transactionId)
        .toString();
  }
}
