package com.trino.client.auth;

import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoSQLException;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.ssl.SSLContextBuilder;

/**
 * Attaches credentials to outgoing requests and reacts to authentication challenges.
 *
 * <p>Implementations are shared by every request of one connection and must be thread safe.
 */
public interface IAuthenticationStrategy {

  /** Adds credentials to the request before it is sent. Called again before every retry. */
  void prepare(HttpUriRequest request) throws TrinoSQLException;

  /**
   * Handles a 401 or 407 response to {@code request}.
   *
   * @param request the request that was rejected, as sent
   * @param response the challenge response
   * @param httpClient unauthenticated client for side requests such as token polling
   * @return true when new credentials are available and the request should be sent again, false
   *     when the rejection is final
   * @throws TrinoSQLException when the challenge cannot be answered
   */
  boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient)
      throws TrinoSQLException;

  /** Adds client key material to the TLS context. Most strategies have none. */
  default void configureSsl(SSLContextBuilder sslContextBuilder) throws TrinoSQLException {}
}
