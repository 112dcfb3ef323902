package com.trino.client.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class WwwAuthenticateParserTest {

  @Test
  void testParsesExternalAuthenticationChallenge() {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse(
            "Bearer x_redirect_server=\"https://coordinator/oauth2/token/initiate/abc\", "
                + "x_token_server=\"https://coordinator/oauth2/token/abc\"");

    assertEquals(1, challenges.size());
    AuthChallenge bearer = challenges.get(0);
    assertTrue(bearer.isScheme("bearer"));
    assertEquals(
        "https://coordinator/oauth2/token/initiate/abc", bearer.getParameter("x_redirect_server"));
    assertEquals("https://coordinator/oauth2/token/abc", bearer.getParameter("X_TOKEN_SERVER"));
    assertNull(bearer.getToken());
  }

  @Test
  void testParsesSeveralChallengesInOneHeader() {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse("Basic realm=\"Trino\", Bearer x_token_server=\"t\"");

    assertEquals(2, challenges.size());
    assertEquals("Basic", challenges.get(0).getScheme());
    assertEquals("Trino", challenges.get(0).getParameter("realm"));
    assertEquals("Bearer", challenges.get(1).getScheme());
    assertEquals("t", challenges.get(1).getParameter("x_token_server"));
  }

  @Test
  void testParsesRepeatedHeaders() {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse(ImmutableList.of("Negotiate", "Basic realm=Trino"));

    assertEquals(2, challenges.size());
    assertEquals("Negotiate", challenges.get(0).getScheme());
    assertTrue(challenges.get(0).getParameters().isEmpty());
    assertEquals("Trino", challenges.get(1).getParameter("realm"));
  }

  @Test
  void testParsesToken68() {
    List<AuthChallenge> challenges = WwwAuthenticateParser.parse("Negotiate YIIB+g==, Basic");

    assertEquals(2, challenges.size());
    assertEquals("YIIB+g==", challenges.get(0).getToken());
    assertEquals("Basic", challenges.get(1).getScheme());
  }

  @Test
  void testQuotedValuesKeepCommasAndEscapes() {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse("Basic realm=\"a, \\\"b\\\"\", charset=\"UTF-8\"");

    assertEquals(1, challenges.size());
    assertEquals("a, \"b\"", challenges.get(0).getParameter("realm"));
    assertEquals("UTF-8", challenges.get(0).getParameter("charset"));
  }

  @Test
  void testEmptyHeaderHasNoChallenges() {
    assertTrue(WwwAuthenticateParser.parse("").isEmpty());
    assertTrue(WwwAuthenticateParser.parse((String) null).isEmpty());
  }

  @Test
  void testStrongestSupportedChallengeWins() {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse(
            ImmutableList.of("Basic realm=Trino", "Bearer x_token_server=\"t\"", "Negotiate"));

    Optional<AuthChallenge> all =
        WwwAuthenticateParser.strongest(
            challenges, ImmutableList.of("Basic", "Bearer", "Negotiate"));
    Optional<AuthChallenge> withoutNegotiate =
        WwwAuthenticateParser.strongest(challenges, ImmutableList.of("basic", "bearer"));

    assertEquals("Negotiate", all.get().getScheme());
    assertEquals("Bearer", withoutNegotiate.get().getScheme());
  }

  @Test
  void testUnsupportedSchemesAreIgnored() {
    List<AuthChallenge> challenges = WwwAuthenticateParser.parse("Digest realm=x, Basic");

    assertFalse(
        WwwAuthenticateParser.strongest(challenges, ImmutableList.of("Bearer")).isPresent());
    assertEquals(
        "Basic",
        WwwAuthenticateParser.strongest(challenges, ImmutableList.of("Basic", "Digest"))
            .get()
            .getScheme());
  }
}
