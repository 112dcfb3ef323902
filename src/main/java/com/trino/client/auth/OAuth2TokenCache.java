package com.trino.client.auth;

/**
 * Storage for tokens obtained through external authentication, keyed by {@code host} or {@code
 * host@user}. Implementations backed by a persistent secret store can be plugged in.
 */
public interface OAuth2TokenCache {

  /** Cached token, or null. */
  String getToken(String key);

  void storeToken(String key, String token);

  void removeToken(String key);
}
