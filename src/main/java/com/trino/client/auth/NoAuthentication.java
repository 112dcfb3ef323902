package com.trino.client.auth;

import com.trino.client.dbclient.TrinoHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;

/** Anonymous access. The user is identified by the {@code X-Trino-User} header only. */
public class NoAuthentication implements IAuthenticationStrategy {

  @Override
  public void prepare(HttpUriRequest request) {}

  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient) {
    return false;
  }
}
