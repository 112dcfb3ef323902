package com.trino.client.dbclient.impl.http;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoConnectionException;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoHttpException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class RetryPolicyTest {

  private static final ZonedDateTime NOW =
      ZonedDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

  private final RetryPolicy policy =
      new RetryPolicy(5, Duration.ofMinutes(2), Duration.ofSeconds(30), () -> 1.0, () -> NOW);

  private static TrinoHttpResponse response(int status, String... headerPairs) {
    ListMultimap<String, String> headers = ArrayListMultimap.create();
    for (int i = 0; i < headerPairs.length; i += 2) {
      headers.put(headerPairs[i], headerPairs[i + 1]);
    }
    return new TrinoHttpResponse(status, headers, "body".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void testSuccessIsReturned() {
    RetryDecision decision =
        policy.decide(1, Duration.ZERO, RequestOutcome.of(response(200)));
    assertEquals(RetryDecision.Action.RETURN, decision.getAction());
  }

  @ParameterizedTest
  @ValueSource(ints = {500, 502, 504})
  void testServerErrorsAreRetriedWithBackoff(int status) {
    RetryDecision decision =
        policy.decide(1, Duration.ZERO, RequestOutcome.of(response(status)));
    assertEquals(RetryDecision.Action.RETRY, decision.getAction());
    assertEquals(Duration.ofMillis(200), decision.getDelay());
  }

  @Test
  void testNetworkFailureIsRetried() {
    RequestOutcome outcome = RequestOutcome.networkFailure(new SocketTimeoutException("timeout"));
    RetryDecision decision = policy.decide(2, Duration.ofSeconds(1), outcome);
    assertEquals(RetryDecision.Action.RETRY, decision.getAction());
    assertEquals(Duration.ofMillis(400), decision.getDelay());
  }

  @Test
  void testRetryAfterSecondsIsHonoured() {
    RetryDecision decision =
        policy.decide(
            1, Duration.ZERO, RequestOutcome.of(response(503, "Retry-After", "7")));
    assertEquals(RetryDecision.Action.RETRY, decision.getAction());
    assertEquals(Duration.ofSeconds(7), decision.getDelay());
  }

  @Test
  void testRetryAfterHttpDateIsHonoured() {
    String at = DateTimeFormatter.RFC_1123_DATE_TIME.format(NOW.plusSeconds(12));
    RetryDecision decision =
        policy.decide(1, Duration.ZERO, RequestOutcome.of(response(429, "Retry-After", at)));
    assertEquals(Duration.ofSeconds(12), decision.getDelay());
  }

  @Test
  void testUnparseableRetryAfterFallsBackToBackoff() {
    RetryDecision decision =
        policy.decide(
            1, Duration.ZERO, RequestOutcome.of(response(503, "Retry-After", "soon")));
    assertEquals(Duration.ofMillis(200), decision.getDelay());
  }

  @Test
  void testBackoffIsCapped() {
    assertEquals(Duration.ofSeconds(30), policy.backoff(20));
    assertEquals(Duration.ofMillis(100), policy.backoff(0));
  }

  @Test
  void testJitterScalesBackoff() {
    RetryPolicy halfJitter =
        new RetryPolicy(5, Duration.ofMinutes(2), Duration.ofSeconds(30), () -> 0.5, () -> NOW);
    assertEquals(Duration.ofMillis(400), halfJitter.backoff(3));
  }

  @Test
  void testAlwaysBusyServerEventuallyFails() {
    RequestOutcome busy = RequestOutcome.of(response(503, "Retry-After", "1"));
    Duration elapsed = Duration.ZERO;
    RetryDecision decision = null;
    int attempt = 0;
    while (attempt < 100) {
      attempt++;
      decision = policy.decide(attempt, elapsed, busy);
      if (decision.getAction() != RetryDecision.Action.RETRY) {
        break;
      }
      elapsed = elapsed.plus(decision.getDelay());
    }
    assertEquals(RetryDecision.Action.FAIL, decision.getAction());
    assertEquals(5, attempt);
    assertTrue(decision.getFailure() instanceof TrinoConnectionException);
    assertEquals(
        TrinoDriverErrorCode.RETRIES_EXHAUSTED, decision.getFailure().getInternalError());
  }

  @Test
  void testElapsedLimitStopsRetries() {
    RetryDecision decision =
        policy.decide(
            2,
            Duration.ofSeconds(119),
            RequestOutcome.of(response(503, "Retry-After", "5")));
    assertEquals(RetryDecision.Action.FAIL, decision.getAction());
    assertTrue(decision.getFailure().getMessage().contains("retry time limit"));
  }

  @Test
  void testExhaustedNetworkFailureKeepsCause() {
    IOException cause = new IOException("connection refused");
    RetryDecision decision = policy.decide(5, Duration.ZERO, RequestOutcome.networkFailure(cause));
    assertEquals(RetryDecision.Action.FAIL, decision.getAction());
    assertSame(cause, decision.getFailure().getCause());
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 403, 404, 409})
  void testClientErrorsAreNotRetried(int status) {
    RetryDecision decision =
        policy.decide(1, Duration.ZERO, RequestOutcome.of(response(status)));
    assertEquals(RetryDecision.Action.FAIL, decision.getAction());
    TrinoHttpException failure = (TrinoHttpException) decision.getFailure();
    assertEquals(status, failure.getStatusCode());
    assertTrue(failure.getMessage().contains("body"));
  }

  @Test
  void testUnauthorizedIsAuthenticationFailure() {
    RetryDecision decision =
        policy.decide(1, Duration.ZERO, RequestOutcome.of(response(401)));
    assertEquals(RetryDecision.Action.FAIL, decision.getAction());
    assertTrue(decision.getFailure() instanceof TrinoAuthenticationException);
  }
}
