package com.trino.client.api.impl.session;

import static com.trino.client.common.TrinoClientConstants.*;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.trino.client.common.util.HeaderValues;
import com.trino.client.dbclient.TrinoHttpResponse;
import java.util.Map;
import java.util.Set;

/** Session changes reported by the coordinator in the headers of one response. */
public final class SessionUpdates {

  private final String setCatalog;
  private final String setSchema;
  private final Map<String, String> setProperties;
  private final Set<String> clearedProperties;
  private final Map<String, String> setRoles;
  private final Map<String, String> addedPreparedStatements;
  private final Set<String> deallocatedPreparedStatements;
  private final String startedTransactionId;
  private final boolean clearTransactionId;

  private SessionUpdates(
      String setCatalog,
      String setSchema,
      Map<String, String> setProperties,
      Set<String> clearedProperties,
      Map<String, String> setRoles,
      Map<String, String> addedPreparedStatements,
      Set<String> deallocatedPreparedStatements,
      String startedTransactionId,
      boolean clearTransactionId) {
    this.setCatalog = setCatalog;
    this.setSchema = setSchema;
    this.setProperties = setProperties;
    this.clearedProperties = clearedProperties;
    this.setRoles = setRoles;
    this.addedPreparedStatements = addedPreparedStatements;
    this.deallocatedPreparedStatements = deallocatedPreparedStatements;
    this.startedTransactionId = startedTransactionId;
    this.clearTransactionId = clearTransactionId;
  }

  public static SessionUpdates fromResponse(TrinoHttpResponse response) {
    String started = response.getHeader(HEADER_STARTED_TRANSACTION);
    if (NO_TRANSACTION.equalsIgnoreCase(started)) {
      started = null;
    }
    return new SessionUpdates(
        response.getHeader(HEADER_SET_CATALOG),
        response.getHeader(HEADER_SET_SCHEMA),
        nameValues(response, HEADER_SET_SESSION),
        names(response, HEADER_CLEAR_SESSION),
        nameValues(response, HEADER_SET_ROLE),
        nameValues(response, HEADER_ADDED_PREPARE),
        names(response, HEADER_DEALLOCATED_PREPARE),
        started,
        response.getHeader(HEADER_CLEAR_TRANSACTION) != null);
  }

  private static Map<String, String> nameValues(TrinoHttpResponse response, String header) {
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (String value : response.getHeaders(header)) {
      for (Map.Entry<String, String> entry : HeaderValues.parseNameValues(value)) {
        values.put(entry);
      }
    }
    return values.buildKeepingLast();
  }

  private static Set<String> names(TrinoHttpResponse response, String header) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (String value : response.getHeaders(header)) {
      for (String name : HeaderValues.splitValues(value)) {
        names.add(HeaderValues.urlDecode(name));
      }
    }
    return names.build();
  }

  public boolean isEmpty() {
    return setCatalog == null
        && setSchema == null
        && setProperties.isEmpty()
        && clearedProperties.isEmpty()
        && setRoles.isEmpty()
        && addedPreparedStatements.isEmpty()
        && deallocatedPreparedStatements.isEmpty()
        && startedTransactionId == null
        && !clearTransactionId;
  }

  public String getSetCatalog() {
    return setCatalog;
  }

  public String getSetSchema() {
    return setSchema;
  }

  public Map<String, String> getSetProperties() {
    return setProperties;
  }

  public Set<String> getClearedProperties() {
    return clearedProperties;
  }

  public Map<String, String> getSetRoles() {
    return setRoles;
  }

  public Map<String, String> getAddedPreparedStatements() {
    return addedPreparedStatements;
  }

  public Set<String> getDeallocatedPreparedStatements() {
    return deallocatedPreparedStatements;
  }

  public String getStartedTransactionId() {
    return startedTransactionId;
  }

  public boolean isClearTransactionId() {
    return clearTransactionId;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("setCatalog", setCatalog)
        .add("setSchema", setSchema)
        .add("setProperties", setProperties.keySet())
        .add("clearedProperties", clearedProperties)
        .add("setRoles", setRoles)
        .add("addedPreparedStatements", addedPreparedStatements.keySet())
        .add("deallocatedPreparedStatements", deallocatedPreparedStatements)
        .add("startedTransactionId", startedTransactionId)
        .add("clearTransactionId", clearTransactionId)
        .toString();
  }
}
