package com.trino.client.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;

/** Static access token sent as {@code Authorization: Bearer}. */
public class BearerTokenAuthentication implements IAuthenticationStrategy {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(BearerTokenAuthentication.class);

  private final String token;

  public BearerTokenAuthentication(String token) {
    this(token, Clock.systemUTC());
  }

  @VisibleForTesting
  BearerTokenAuthentication(String token, Clock clock) {
    this.token = checkNotNull(token, "token is null");
    if (isExpired(token, clock)) {
      LOGGER.warn("The configured access token has expired; the server will likely reject it");
    }
  }

  @Override
  public void prepare(HttpUriRequest request) {
    request.setHeader(TrinoClientConstants.HEADER_AUTHORIZATION, "Bearer " + token);
  }

  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient) {
    return false;
  }

  /** True for a JWT whose {@code exp} claim is in the past. Opaque tokens never expire. */
  @VisibleForTesting
  static boolean isExpired(String token, Clock clock) {
    try {
      JWTClaimsSet claims = SignedJWT.parse(token).getJWTClaimsSet();
      if (claims.getExpirationTime() == null) {
        return false;
      }
      return claims.getExpirationTime().toInstant().isBefore(Instant.now(clock));
    } catch (ParseException e) {
      LOGGER.debug("Access token is not a JWT, skipping expiry check");
      return false;
    }
  }
}
