package com.trino.client.auth;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code WWW-Authenticate} headers.
 *
 * <p>The header may appear several times, and a single value may carry several comma separated
 * challenges. Each challenge is a scheme followed either by a token68 or by {@code name=value}
 * parameters, where values may be quoted.
 */
public final class WwwAuthenticateParser {

  public static final String NEGOTIATE = "Negotiate";
  public static final String BEARER = "Bearer";
  public static final String BASIC = "Basic";

  /** Schemes from strongest to weakest. */
  private static final List<String> STRENGTH_ORDER = ImmutableList.of(NEGOTIATE, BEARER, BASIC);

  private static final Pattern TOKEN68 = Pattern.compile("[A-Za-z0-9\\-._~+/]+=*(?=\\s*(,|$))");

  private WwwAuthenticateParser() {}

  public static List<AuthChallenge> parse(Collection<String> headerValues) {
    List<AuthChallenge> challenges = new ArrayList<>();
    for (String value : headerValues) {
      challenges.addAll(parse(value));
    }
    return challenges;
  }

  public static List<AuthChallenge> parse(String headerValue) {
    List<AuthChallenge> challenges = new ArrayList<>();
    Cursor cursor = new Cursor(headerValue);
    while (true) {
      cursor.skip(" \t,");
      if (cursor.atEnd()) {
        return challenges;
      }
      String scheme = cursor.readUntil(" \t,");
      cursor.skip(" \t");
      String token = null;
      Map<String, String> parameters = new LinkedHashMap<>();
      Matcher token68 = TOKEN68.matcher(headerValue);
      token68.region(cursor.position, headerValue.length());
      if (token68.lookingAt()) {
        token = token68.group();
        cursor.position = token68.end();
      } else {
        readParameters(cursor, parameters);
      }
      challenges.add(new AuthChallenge(scheme, parameters, token));
    }
  }

  /**
   * Picks the strongest challenge whose scheme is in {@code supportedSchemes}. Challenges for
   * schemes outside the strength order are ignored.
   */
  public static Optional<AuthChallenge> strongest(
      List<AuthChallenge> challenges, Collection<String> supportedSchemes) {
    for (String scheme : STRENGTH_ORDER) {
      if (!containsIgnoreCase(supportedSchemes, scheme)) {
        continue;
      }
      for (AuthChallenge challenge : challenges) {
        if (challenge.isScheme(scheme)) {
          return Optional.of(challenge);
        }
      }
    }
    return Optional.empty();
  }

  private static void readParameters(Cursor cursor, Map<String, String> parameters) {
    while (!cursor.atEnd()) {
      int start = cursor.position;
      String name = cursor.readUntil("=, \t");
      cursor.skip(" \t");
      if (name.isEmpty() || cursor.atEnd() || cursor.peek() != '=') {
        // next challenge starts here
        cursor.position = start;
        return;
      }
      cursor.position++;
      cursor.skip(" \t");
      String value =
          cursor.atEnd() || cursor.peek() != '"' ? cursor.readUntil(",") : cursor.readQuoted();
      parameters.put(name.toLowerCase(Locale.ROOT), value.trim());
      cursor.skip(" \t");
      if (cursor.atEnd() || cursor.peek() != ',') {
        return;
      }
      cursor.position++;
      cursor.skip(" \t");
    }
  }

  private static boolean containsIgnoreCase(Collection<String> values, String value) {
    for (String candidate : values) {
      if (candidate.equalsIgnoreCase(value)) {
        return true;
      }
    }
    return false;
  }

  private static final class Cursor {
    private final String text;
    private int position;

    Cursor(String text) {
      this.text = text == null ? "" : text;
    }

    boolean atEnd() {
      return position >= text.length();
    }

    char peek() {
      return text.charAt(position);
    }

    void skip(String characters) {
      while (!atEnd() && characters.indexOf(peek()) >= 0) {
        position++;
      }
    }

    String readUntil(String delimiters) {
      int start = position;
      while (!atEnd() && delimiters.indexOf(peek()) < 0) {
        position++;
      }
      return text.substring(start, position);
    }

    String readQuoted() {
      StringBuilder value = new StringBuilder();
      position++;
      while (!atEnd()) {
        char c = text.charAt(position++);
        if (c == '"') {
          break;
        }
        if (c == '\\' && !atEnd()) {
          c = text.charAt(position++);
        }
        value.append(c);
      }
      return value.toString();
    }
  }
}
