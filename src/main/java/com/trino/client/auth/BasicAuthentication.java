package com.trino.client.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.io.BaseEncoding;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.dbclient.TrinoHttpResponse;
import java.nio.charset.StandardCharsets;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;

/** Static user and password sent as {@code Authorization: Basic}. */
public class BasicAuthentication implements IAuthenticationStrategy {

  private final String headerValue;

  public BasicAuthentication(String user, String password) {
    checkNotNull(user, "user is null");
    checkNotNull(password, "password is null");
    this.headerValue =
        "Basic "
            + BaseEncoding.base64()
                .encode((user + ":" + password).getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void prepare(HttpUriRequest request) {
    request.setHeader(TrinoClientConstants.HEADER_AUTHORIZATION, headerValue);
  }

  /** Static credentials cannot be renewed; the rejection is final. */
  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient) {
    return false;
  }
}
