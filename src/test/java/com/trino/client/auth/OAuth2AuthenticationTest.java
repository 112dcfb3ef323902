package com.trino.client.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.google.common.collect.ImmutableListMultimap;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoAuthenticationException;
import java.io.IOException;
import java.net.URI;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class OAuth2AuthenticationTest {

  @RegisterExtension
  static WireMockExtension tokenServer =
      WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

  @Mock RedirectHandler redirectHandler;

  private final CloseableHttpClient httpClient = HttpClients.createDefault();

  @AfterEach
  void tearDown() throws IOException {
    httpClient.close();
  }

  private static String tokenUrl() {
    return tokenServer.baseUrl() + "/oauth2/token/abc";
  }

  private TrinoHttpResponse challenge(boolean withRedirect) {
    String value = "Bearer x_token_server=\"" + tokenUrl() + "\"";
    if (withRedirect) {
      value += ", x_redirect_server=\"https://coordinator/oauth2/token/initiate/abc\"";
    }
    return new TrinoHttpResponse(
        401, ImmutableListMultimap.of("WWW-Authenticate", value), new byte[0]);
  }

  private static HttpGet statementRequest(String user) {
    HttpGet request = new HttpGet("https://coordinator:8443/v1/statement/q1");
    if (user != null) {
      request.setHeader("X-Trino-User", user);
    }
    return request;
  }

  @Test
  void testChallengeRunsRedirectFlowAndCachesToken() throws Exception {
    tokenServer.stubFor(
        get("/oauth2/token/abc")
            .willReturn(
                okJson("{\"nextUri\":\"" + tokenServer.baseUrl() + "/oauth2/token/abc/2\"}")));
    tokenServer.stubFor(get("/oauth2/token/abc/2").willReturn(okJson("{\"token\":\"t-123\"}")));
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    HttpGet rejected = statementRequest("alice");
    assertTrue(authentication.handleChallenge(rejected, challenge(true), httpClient));

    verify(redirectHandler).redirectTo(URI.create("https://coordinator/oauth2/token/initiate/abc"));
    HttpGet retried = statementRequest("alice");
    authentication.prepare(retried);
    assertEquals("Bearer t-123", retried.getFirstHeader("Authorization").getValue());
  }

  @Test
  void testTokensAreCachedPerUser() throws Exception {
    tokenServer.stubFor(get("/oauth2/token/abc").willReturn(okJson("{\"token\":\"alice-token\"}")));
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    authentication.handleChallenge(statementRequest("alice"), challenge(false), httpClient);

    HttpGet bob = statementRequest("bob");
    authentication.prepare(bob);
    HttpGet anonymous = statementRequest(null);
    authentication.prepare(anonymous);
    assertNull(bob.getFirstHeader("Authorization"));
    assertNull(anonymous.getFirstHeader("Authorization"));
    verifyNoInteractions(redirectHandler);
  }

  @Test
  void testTokenObtainedByAnotherCallerIsReused() throws Exception {
    InMemoryOAuth2TokenCache cache = new InMemoryOAuth2TokenCache();
    cache.storeToken("coordinator@alice", "fresh");
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler, cache);
    HttpGet rejected = statementRequest("alice");
    rejected.setHeader("Authorization", "Bearer stale");

    assertTrue(authentication.handleChallenge(rejected, challenge(true), httpClient));

    tokenServer.verify(0, getRequestedFor(anyUrl()));
    assertEquals("fresh", cache.getToken("coordinator@alice"));
  }

  @Test
  void testRejectedCachedTokenIsReplaced() throws Exception {
    tokenServer.stubFor(get("/oauth2/token/abc").willReturn(okJson("{\"token\":\"new\"}")));
    InMemoryOAuth2TokenCache cache = new InMemoryOAuth2TokenCache();
    cache.storeToken("coordinator", "old");
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler, cache);
    HttpGet rejected = statementRequest(null);
    authentication.prepare(rejected);

    assertTrue(authentication.handleChallenge(rejected, challenge(false), httpClient));

    assertEquals("new", cache.getToken("coordinator"));
  }

  @Test
  void testTokenServerErrorFailsAuthentication() {
    tokenServer.stubFor(get("/oauth2/token/abc").willReturn(okJson("{\"error\":\"denied\"}")));
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    TrinoAuthenticationException e =
        assertThrows(
            TrinoAuthenticationException.class,
            () ->
                authentication.handleChallenge(
                    statementRequest("alice"), challenge(false), httpClient));
    assertTrue(e.getMessage().contains("denied"));
  }

  @Test
  void testTokenServerFailureStatus() {
    tokenServer.stubFor(
        get("/oauth2/token/abc").willReturn(aResponse().withStatus(500).withBody("boom")));
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    TrinoAuthenticationException e =
        assertThrows(
            TrinoAuthenticationException.class,
            () -> authentication.pollForToken(tokenUrl(), httpClient));
    assertEquals(
        "Error while getting the token response status code: 500, body: boom", e.getMessage());
  }

  @Test
  void testPollingIsBounded() {
    tokenServer.stubFor(
        get("/oauth2/token/abc")
            .willReturn(okJson("{\"nextUri\":\"" + tokenUrl() + "\"}")));
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    TrinoAuthenticationException e =
        assertThrows(
            TrinoAuthenticationException.class,
            () -> authentication.pollForToken(tokenUrl(), httpClient));
    assertEquals("Exceeded max attempts while getting the token", e.getMessage());
    tokenServer.verify(
        OAuth2Authentication.MAX_TOKEN_POLL_ATTEMPTS,
        getRequestedFor(urlEqualTo("/oauth2/token/abc")));
  }

  @Test
  void testChallengeWithoutTokenServerIsRejected() {
    TrinoHttpResponse basicOnly =
        new TrinoHttpResponse(
            401, ImmutableListMultimap.of("WWW-Authenticate", "Basic realm=Trino"), new byte[0]);
    OAuth2Authentication authentication = new OAuth2Authentication(redirectHandler);

    assertThrows(
        TrinoAuthenticationException.class,
        () -> authentication.handleChallenge(statementRequest(null), basicOnly, httpClient));
  }

  @Test
  void testCacheKey() {
    assertEquals("coordinator", OAuth2Authentication.cacheKey(statementRequest(null)));
    assertEquals("coordinator@bob", OAuth2Authentication.cacheKey(statementRequest("bob")));
  }
}
