package com.trino.client.api.impl.session;

import com.google.common.collect.ImmutableMap;
import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Session state of one connection: catalog, schema, session properties, roles, prepared
 * statements and the current transaction id.
 *
 * <p>Only this class mutates the state. Requests read an immutable {@link SessionSnapshot}, and
 * changes reported by the coordinator come back as {@link SessionUpdates} applied in one step.
 * All access is serialized on the instance.
 */
public class TrinoSession {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(TrinoSession.class);

  private final ITrinoConnectionContext context;
  private String catalog;
  private String schema;
  private final Map<String, String> properties;
  private final Map<String, String> roles;
  private final Map<String, String> preparedStatements = new LinkedHashMap<>();
  private String transactionId;

  public TrinoSession(ITrinoConnectionContext context) {
    this.context = context;
    this.catalog = context.getCatalog();
    this.schema = context.getSchema();
    this.properties = new LinkedHashMap<>(context.getSessionProperties());
    this.roles = new LinkedHashMap<>();
    context.getRoles().forEach((catalogName, role) -> roles.put(catalogName, formatRole(role)));
  }

  /** {@code ALL} and {@code NONE} are sent as is, any other role as {@code ROLE{name}}. */
  static String formatRole(String role) {
    String upper = role.toUpperCase(Locale.ROOT);
    if ("ALL".equals(upper) || "NONE".equals(upper)) {
      return upper;
    }
    return "ROLE{" + role + "}";
  }

  public synchronized SessionSnapshot snapshot() {
    return new SessionSnapshot(
        context.getUser(),
        context.getSource(),
        catalog,
        schema,
        context.getTimeZone(),
        context.getLocale(),
        context.getClientInfo(),
        properties,
        context.getClientTags(),
        roles,
        context.getExtraCredentials(),
        context.getHttpHeaders(),
        preparedStatements,
        context.getEncodings(),
        transactionId);
  }

  public synchronized void apply(SessionUpdates updates) {
    if (updates.isEmpty()) {
      return;
    }
    LOGGER.debug("Applying session updates %s", updates);
    if (updates.getSetCatalog() != null) {
      catalog = updates.getSetCatalog();
    }
    if (updates.getSetSchema() != null) {
      schema = updates.getSetSchema();
    }
    properties.putAll(updates.getSetProperties());
    for (String name : updates.getClearedProperties()) {
      properties.remove(name);
    }
    roles.putAll(updates.getSetRoles());
    preparedStatements.putAll(updates.getAddedPreparedStatements());
    for (String name : updates.getDeallocatedPreparedStatements()) {
      preparedStatements.remove(name);
    }
    if (updates.getStartedTransactionId() != null) {
      transactionId = updates.getStartedTransactionId();
      LOGGER.info("Transaction started: %s", transactionId);
    }
    if (updates.isClearTransactionId()) {
      LOGGER.info("Transaction finished: %s", transactionId);
      transactionId = null;
    }
  }

  public synchronized String getTransactionId() {
    return transactionId;
  }

  public synchronized boolean inTransaction() {
    return transactionId != null;
  }

  /** Returns to autocommit after a commit or rollback. */
  public synchronized void clearTransaction() {
    transactionId = null;
  }

  public synchronized String getCatalog() {
    return catalog;
  }

  public synchronized String getSchema() {
    return schema;
  }

  public synchronized Map<String, String> getProperties() {
    return ImmutableMap.copyOf(properties);
  }

  public synchronized Map<String, String> getRoles() {
    return ImmutableMap.copyOf(roles);
  }

  public synchronized Map<String, String> getPreparedStatements() {
    return ImmutableMap.copyOf(preparedStatements);
  }
}
