package com.trino.client.dbclient.impl.http;

import com.trino.client.dbclient.TrinoHttpResponse;
import java.io.IOException;

/** Result of a single HTTP attempt, classified for the retry policy. */
public final class RequestOutcome {

  public enum Kind {
    SUCCESS,
    NETWORK_FAILURE,
    SERVER_ERROR,
    BUSY,
    AUTHENTICATION_FAILURE,
    CLIENT_ERROR
  }

  private final Kind kind;
  private final TrinoHttpResponse response;
  private final IOException failure;
  private final String detail;

  private RequestOutcome(
      Kind kind, TrinoHttpResponse response, IOException failure, String detail) {
    this.kind = kind;
    this.response = response;
    this.failure = failure;
    this.detail = detail;
  }

  public static RequestOutcome of(TrinoHttpResponse response) {
    int status = response.getStatusCode();
    Kind kind;
    if (status == 429 || status == 503) {
      kind = Kind.BUSY;
    } else if (status >= 500) {
      kind = Kind.SERVER_ERROR;
    } else if (status == 401 || status == 407) {
      kind = Kind.AUTHENTICATION_FAILURE;
    } else if (status >= 400) {
      kind = Kind.CLIENT_ERROR;
    } else {
      kind = Kind.SUCCESS;
    }
    return new RequestOutcome(kind, response, null, null);
  }

  public static RequestOutcome networkFailure(IOException failure) {
    return new RequestOutcome(Kind.NETWORK_FAILURE, null, failure, failure.getMessage());
  }

  public Kind getKind() {
    return kind;
  }

  /** Response of the attempt; null for network failures. */
  public TrinoHttpResponse getResponse() {
    return response;
  }

  public IOException getFailure() {
    return failure;
  }

  /** Human readable summary used in logs and error messages. */
  public String describe() {
    if (kind == Kind.NETWORK_FAILURE) {
      return "network failure: " + detail;
    }
    return "HTTP " + response.getStatusCode();
  }
}
