package com.trino.client.auth;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process local token cache. Tokens are lost when the JVM exits. */
public class InMemoryOAuth2TokenCache implements OAuth2TokenCache {

  private final Map<String, String> tokens = new ConcurrentHashMap<>();

  @Override
  public String getToken(String key) {
    return tokens.get(key);
  }

  @Override
  public void storeToken(String key, String token) {
    tokens.put(key, token);
  }

  @Override
  public void removeToken(String key) {
    tokens.remove(key);
  }
}
