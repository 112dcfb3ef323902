package com.trino.client.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.ssl.SSLContextBuilder;

/** Mutual TLS with a client certificate and key read from a key store. */
public class CertificateAuthentication implements IAuthenticationStrategy {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(CertificateAuthentication.class);

  private final String keyStorePath;
  private final char[] keyStorePassword;
  private final String keyStoreType;

  public CertificateAuthentication(
      String keyStorePath, String keyStorePassword, String keyStoreType) {
    this.keyStorePath = checkNotNull(keyStorePath, "keyStorePath is null");
    this.keyStorePassword = keyStorePassword == null ? new char[0] : keyStorePassword.toCharArray();
    this.keyStoreType = checkNotNull(keyStoreType, "keyStoreType is null");
  }

  @Override
  public void prepare(HttpUriRequest request) {}

  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient) {
    return false;
  }

  @Override
  public void configureSsl(SSLContextBuilder sslContextBuilder) throws TrinoSQLException {
    KeyStore keyStore = loadKeyStore();
    try {
      sslContextBuilder.loadKeyMaterial(keyStore, keyStorePassword);
    } catch (GeneralSecurityException e) {
      throw new TrinoAuthenticationException(
          "Cannot use key material from " + keyStorePath + ": " + e.getMessage(), e);
    }
  }

  KeyStore loadKeyStore() throws TrinoSQLException {
    LOGGER.debug("Loading %s client key store from %s", keyStoreType, keyStorePath);
    try (InputStream in = Files.newInputStream(Paths.get(keyStorePath))) {
      KeyStore keyStore = KeyStore.getInstance(keyStoreType);
      keyStore.load(in, keyStorePassword);
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new TrinoAuthenticationException(
          "Cannot load key store " + keyStorePath + ": " + e.getMessage(), e);
    }
  }
}
