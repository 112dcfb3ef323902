package com.trino.client.auth;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;

/** One challenge of a {@code WWW-Authenticate} header: a scheme plus parameters or a token. */
public final class AuthChallenge {

  private final String scheme;
  private final Map<String, String> parameters;
  private final String token;

  public AuthChallenge(String scheme, Map<String, String> parameters, String token) {
    this.scheme = scheme;
    this.parameters = ImmutableMap.copyOf(parameters);
    this.token = token;
  }

  public String getScheme() {
    return scheme;
  }

  public boolean isScheme(String name) {
    return scheme.equalsIgnoreCase(name);
  }

  /** Parameter value by case-insensitive name, or null. */
  public String getParameter(String name) {
    return parameters.get(name.toLowerCase(Locale.ROOT));
  }

  public Map<String, String> getParameters() {
    return parameters;
  }

  /** The token68 form used by {@code Negotiate}, or null. */
  public String getToken() {
    return token;
  }

  @Override
  public String toString() {
    // parameter values may carry server URLs only; tokens are not printed
    return MoreObjects.toStringHelper(this)
        .add("scheme", scheme)
        .add("parameters", parameters.keySet())
        .add("hasToken", token != null)
        .toString();
  }
}
