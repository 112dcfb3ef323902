package com.trino.client.auth;

import com.trino.client.exception.TrinoSQLException;

/** Produces SPNEGO tokens. The default implementation uses the JDK's GSS-API. */
public interface GssNegotiator {

  /**
   * Creates the initial security context token for a host based service.
   *
   * @param servicePrincipal service name in {@code service@host} form
   * @param clientPrincipal principal to authenticate as, or null for the default credentials
   * @param delegate whether to request credential delegation
   */
  byte[] initiate(String servicePrincipal, String clientPrincipal, boolean delegate)
      throws TrinoSQLException;

  /** Whether the token should be sent before the server asks for it. */
  default boolean isPreemptive() {
    return false;
  }
}
