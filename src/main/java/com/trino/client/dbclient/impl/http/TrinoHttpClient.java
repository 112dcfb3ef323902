package com.trino.client.dbclient.impl.http;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.trino.client.auth.IAuthenticationStrategy;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoConnectionException;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.io.IOException;
import java.time.Duration;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

/**
 * Blocking HTTP client shared by every request of one connection.
 *
 * <p>Each attempt is prepared by the authentication strategy, executed, and fully buffered. A 401
 * or 407 first goes to the strategy's challenge handler, which may renew credentials and have the
 * request sent again without consuming an attempt. Every other outcome goes through the {@link
 * RetryPolicy}.
 */
public class TrinoHttpClient implements ITrinoHttpClient {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(TrinoHttpClient.class);

  static final int MAX_CHALLENGE_ROUNDS = 2;

  private final CloseableHttpClient httpClient;
  private final IAuthenticationStrategy authentication;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final Ticker ticker;

  public TrinoHttpClient(
      CloseableHttpClient httpClient,
      IAuthenticationStrategy authentication,
      RetryPolicy retryPolicy) {
    this(httpClient, authentication, retryPolicy, Sleeper.THREAD_SLEEPER, Ticker.systemTicker());
  }

  @VisibleForTesting
  TrinoHttpClient(
      CloseableHttpClient httpClient,
      IAuthenticationStrategy authentication,
      RetryPolicy retryPolicy,
      Sleeper sleeper,
      Ticker ticker) {
    this.httpClient = httpClient;
    this.authentication = authentication;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
    this.ticker = ticker;
  }

  @Override
  public TrinoHttpResponse execute(HttpUriRequest request) throws TrinoSQLException {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    int attempt = 0;
    while (true) {
      attempt++;
      RequestOutcome outcome = attemptWithChallenges(request);
      Duration elapsed = stopwatch.elapsed();
      RetryDecision decision = retryPolicy.decide(attempt, elapsed, outcome);
      switch (decision.getAction()) {
        case RETURN:
          return outcome.getResponse();
        case FAIL:
          LOGGER.error(
              "%s %s failed on attempt %d: %s",
              request.getMethod(),
              request.getURI(),
              attempt,
              decision.getFailure().getMessage());
          throw decision.getFailure();
        default:
          LOGGER.warn(
              "%s %s attempt %d of %d failed (%s), retrying in %d ms",
              request.getMethod(),
              request.getURI(),
              attempt,
              retryPolicy.getMaxAttempts(),
              outcome.describe(),
              decision.getDelay().toMillis());
          sleep(decision.getDelay());
      }
    }
  }

  @Override
  public TrinoHttpResponse executeOnce(HttpUriRequest request) throws TrinoSQLException {
    RequestOutcome outcome = attemptWithChallenges(request);
    if (outcome.getKind() == RequestOutcome.Kind.NETWORK_FAILURE) {
      throw new TrinoConnectionException(
          outcome.describe(), outcome.getFailure(), TrinoDriverErrorCode.CONNECTION_ERROR);
    }
    return outcome.getResponse();
  }

  private RequestOutcome attemptWithChallenges(HttpUriRequest request) throws TrinoSQLException {
    RequestOutcome outcome = attemptOnce(request);
    int rounds = 0;
    while (outcome.getKind() == RequestOutcome.Kind.AUTHENTICATION_FAILURE
        && rounds < MAX_CHALLENGE_ROUNDS
        && authentication.handleChallenge(request, outcome.getResponse(), httpClient)) {
      rounds++;
      LOGGER.debug("Retrying %s with renewed credentials", request.getURI());
      outcome = attemptOnce(request);
    }
    return outcome;
  }

  private RequestOutcome attemptOnce(HttpUriRequest request) throws TrinoSQLException {
    authentication.prepare(request);
    try (CloseableHttpResponse response = httpClient.execute(request)) {
      ListMultimap<String, String> headers = ArrayListMultimap.create();
      for (Header header : response.getAllHeaders()) {
        headers.put(header.getName(), header.getValue());
      }
      HttpEntity entity = response.getEntity();
      byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      return RequestOutcome.of(
          new TrinoHttpResponse(response.getStatusLine().getStatusCode(), headers, body));
    } catch (IOException e) {
      LOGGER.debug("%s %s failed: %s", request.getMethod(), request.getURI(), e.getMessage());
      return RequestOutcome.networkFailure(e);
    }
  }

  private void sleep(Duration delay) throws TrinoConnectionException {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TrinoConnectionException(
          "Interrupted while waiting to retry", e, TrinoDriverErrorCode.THREAD_INTERRUPTED_ERROR);
    }
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }
}
