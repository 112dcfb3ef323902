package com.trino.client.dbclient.impl.http;

import com.google.common.annotations.VisibleForTesting;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoConnectionException;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoHttpException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Decides whether an HTTP attempt is retried, and after how long.
 *
 * <p>The decision depends only on the attempt number, the time spent so far and the outcome of the
 * attempt. Transient outcomes (network failures, 5xx, 429) are retried with exponential backoff
 * and jitter, or after the delay the server requested in {@code Retry-After}. Once the attempt
 * count or the elapsed time limit would be exceeded, the last outcome becomes a {@link
 * TrinoConnectionException}.
 */
public class RetryPolicy {

  static final Duration BASE_DELAY = Duration.ofMillis(100);
  static final int EXPONENT = 2;
  static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  private final int maxAttempts;
  private final Duration maxElapsed;
  private final Duration maxDelay;
  private final DoubleSupplier jitter;
  private final Supplier<ZonedDateTime> clock;

  public RetryPolicy(int maxAttempts, Duration maxElapsed) {
    this(
        maxAttempts,
        maxElapsed,
        DEFAULT_MAX_DELAY,
        () -> ThreadLocalRandom.current().nextDouble(),
        ZonedDateTime::now);
  }

  @VisibleForTesting
  RetryPolicy(
      int maxAttempts,
      Duration maxElapsed,
      Duration maxDelay,
      DoubleSupplier jitter,
      Supplier<ZonedDateTime> clock) {
    this.maxAttempts = maxAttempts;
    this.maxElapsed = maxElapsed;
    this.maxDelay = maxDelay;
    this.jitter = jitter;
    this.clock = clock;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * @param attempt number of the attempt that just completed, starting at 1
   * @param elapsed time since the first attempt started
   * @param outcome result of the attempt
   */
  public RetryDecision decide(int attempt, Duration elapsed, RequestOutcome outcome) {
    switch (outcome.getKind()) {
      case SUCCESS:
        return RetryDecision.returnResponse();
      case AUTHENTICATION_FAILURE:
        return RetryDecision.fail(
            new TrinoAuthenticationException(
                "Authentication failed: " + outcome.describe() + bodySnippet(outcome)));
      case CLIENT_ERROR:
        return RetryDecision.fail(
            new TrinoHttpException(
                "error " + outcome.getResponse().getStatusCode() + bodySnippet(outcome),
                outcome.getResponse().getStatusCode()));
      case BUSY:
        Duration requested = retryAfter(outcome);
        Duration delay = requested != null ? requested : backoff(attempt);
        return retryOrGiveUp(attempt, elapsed, outcome, delay);
      default:
        return retryOrGiveUp(attempt, elapsed, outcome, backoff(attempt));
    }
  }

  private RetryDecision retryOrGiveUp(
      int attempt, Duration elapsed, RequestOutcome outcome, Duration delay) {
    if (attempt >= maxAttempts) {
      return RetryDecision.fail(
          exhausted(
              String.format("failed after %d attempts: %s", attempt, outcome.describe()),
              outcome));
    }
    if (elapsed.plus(delay).compareTo(maxElapsed) > 0) {
      return RetryDecision.fail(
          exhausted(
              String.format(
                  "retry time limit of %s exceeded after %d attempts: %s",
                  maxElapsed, attempt, outcome.describe()),
              outcome));
    }
    return RetryDecision.retryAfter(delay);
  }

  private static TrinoConnectionException exhausted(String message, RequestOutcome outcome) {
    if (outcome.getFailure() != null) {
      return new TrinoConnectionException(
          message, outcome.getFailure(), TrinoDriverErrorCode.RETRIES_EXHAUSTED);
    }
    return new TrinoConnectionException(message, TrinoDriverErrorCode.RETRIES_EXHAUSTED);
  }

  /** Exponential backoff: {@code base * 2^attempt}, scaled by a random jitter, capped. */
  @VisibleForTesting
  Duration backoff(int attempt) {
    double millis = BASE_DELAY.toMillis() * Math.pow(EXPONENT, attempt) * jitter.getAsDouble();
    return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis((long) millis);
  }

  /** Delay requested by {@code Retry-After}, either in seconds or as an HTTP date. */
  @VisibleForTesting
  Duration retryAfter(RequestOutcome outcome) {
    String value = outcome.getResponse().getHeader(TrinoClientConstants.HEADER_RETRY_AFTER);
    if (value == null) {
      return null;
    }
    Duration delay;
    try {
      delay = Duration.ofSeconds(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      try {
        ZonedDateTime at = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        delay = Duration.between(clock.get(), at);
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
    if (delay.isNegative()) {
      return Duration.ZERO;
    }
    return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
  }

  private static String bodySnippet(RequestOutcome outcome) {
    String body = outcome.getResponse().getBodyAsString();
    if (body.isEmpty()) {
      return "";
    }
    return ": " + (body.length() > 200 ? body.substring(0, 200) + "..." : body);
  }
}
