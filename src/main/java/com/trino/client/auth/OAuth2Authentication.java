package com.trino.client.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import org.apache.http.Header;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

/**
 * Trino external authentication.
 *
 * <p>When the coordinator answers 401 with a {@code Bearer} challenge carrying {@code
 * x_token_server}, the user is sent to {@code x_redirect_server} (if present) and the token server
 * is polled until it hands out a token. The token is cached per host and user and attached to
 * every following request. Only one flow runs per cache key; concurrent callers block until it
 * finishes and then reuse its token.
 */
public class OAuth2Authentication implements IAuthenticationStrategy {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(OAuth2Authentication.class);

  static final int MAX_TOKEN_POLL_ATTEMPTS = 5;
  static final String REDIRECT_SERVER = "x_redirect_server";
  static final String TOKEN_SERVER = "x_token_server";

  private final RedirectHandler redirectHandler;
  private final OAuth2TokenCache tokenCache;
  private final Striped<Lock> flowLocks = Striped.lazyWeakLock(64);

  public OAuth2Authentication(RedirectHandler redirectHandler) {
    this(redirectHandler, new InMemoryOAuth2TokenCache());
  }

  public OAuth2Authentication(RedirectHandler redirectHandler, OAuth2TokenCache tokenCache) {
    this.redirectHandler = checkNotNull(redirectHandler, "redirectHandler is null");
    this.tokenCache = checkNotNull(tokenCache, "tokenCache is null");
  }

  @Override
  public void prepare(HttpUriRequest request) {
    String token = tokenCache.getToken(cacheKey(request));
    if (token != null) {
      request.setHeader(TrinoClientConstants.HEADER_AUTHORIZATION, "Bearer " + token);
    }
  }

  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient)
      throws TrinoSQLException {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse(
            response.getHeaders(TrinoClientConstants.HEADER_WWW_AUTHENTICATE));
    Optional<AuthChallenge> bearer =
        WwwAuthenticateParser.strongest(
            challenges, ImmutableList.of(WwwAuthenticateParser.BEARER));
    if (!bearer.isPresent()) {
      throw new TrinoAuthenticationException(
          "Server did not offer a Bearer challenge for external authentication");
    }
    String tokenServer = bearer.get().getParameter(TOKEN_SERVER);
    if (tokenServer == null) {
      throw new TrinoAuthenticationException(
          "Bearer challenge does not carry " + TOKEN_SERVER);
    }

    String key = cacheKey(request);
    String rejectedToken = sentToken(request);
    Lock lock = flowLocks.get(key);
    lock.lock();
    try {
      String cached = tokenCache.getToken(key);
      if (cached != null && !cached.equals(rejectedToken)) {
        // another caller completed a flow while this one waited
        return true;
      }
      tokenCache.removeToken(key);
      String redirectServer = bearer.get().getParameter(REDIRECT_SERVER);
      if (redirectServer != null) {
        redirectHandler.redirectTo(toUri(redirectServer));
      }
      String token = pollForToken(tokenServer, httpClient);
      tokenCache.storeToken(key, token);
      LOGGER.debug("Obtained access token for %s", key);
      return true;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  String pollForToken(String tokenServer, CloseableHttpClient httpClient)
      throws TrinoSQLException {
    String next = tokenServer;
    for (int attempt = 1; attempt <= MAX_TOKEN_POLL_ATTEMPTS; attempt++) {
      HttpGet get = new HttpGet(toUri(next));
      JsonNode body;
      try (CloseableHttpResponse response = httpClient.execute(get)) {
        String text =
            response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
        int status = response.getStatusLine().getStatusCode();
        if (status != 200) {
          throw new TrinoAuthenticationException(
              String.format(
                  "Error while getting the token response status code: %d, body: %s",
                  status, text));
        }
        body = JsonUtil.getMapper().readTree(text);
      } catch (IOException e) {
        throw new TrinoAuthenticationException(
            "Error while polling the token server: " + e.getMessage(), e);
      }
      if (body.hasNonNull("token")) {
        return body.get("token").asText();
      }
      if (body.hasNonNull("error")) {
        throw new TrinoAuthenticationException(
            "Error while getting the token: " + body.get("error").asText());
      }
      if (!body.hasNonNull("nextUri")) {
        throw new TrinoAuthenticationException(
            "Token server response carries neither a token nor a nextUri");
      }
      next = body.get("nextUri").asText();
      LOGGER.debug("Token not ready, polling %s", next);
    }
    throw new TrinoAuthenticationException("Exceeded max attempts while getting the token");
  }

  /** {@code host}, or {@code host@user} when the request names a user. */
  @VisibleForTesting
  static String cacheKey(HttpUriRequest request) {
    String host = request.getURI().getHost();
    Header user = request.getFirstHeader(TrinoClientConstants.HEADER_USER);
    if (user == null || user.getValue() == null) {
      return host;
    }
    return host + "@" + user.getValue();
  }

  private static String sentToken(HttpUriRequest request) {
    Header authorization = request.getFirstHeader(TrinoClientConstants.HEADER_AUTHORIZATION);
    if (authorization == null || !authorization.getValue().startsWith("Bearer ")) {
      return null;
    }
    return authorization.getValue().substring("Bearer ".length());
  }

  private static URI toUri(String value) throws TrinoAuthenticationException {
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      throw new TrinoAuthenticationException("Invalid external authentication URI: " + value, e);
    }
  }
}
