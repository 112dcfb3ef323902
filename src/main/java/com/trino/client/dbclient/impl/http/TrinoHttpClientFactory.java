package com.trino.client.dbclient.impl.http;

import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.auth.IAuthenticationStrategy;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.exception.TrinoConnectionException;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.security.GeneralSecurityException;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.ssl.SSLContexts;

/** Builds the {@link TrinoHttpClient} of a connection from its settings. */
public final class TrinoHttpClientFactory {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(TrinoHttpClientFactory.class);

  private TrinoHttpClientFactory() {}

  public static TrinoHttpClient create(
      ITrinoConnectionContext context, IAuthenticationStrategy authentication)
      throws TrinoSQLException {
    int timeoutMillis = (int) Duration.ofSeconds(context.getRequestTimeoutSeconds()).toMillis();
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(timeoutMillis)
            .setConnectionRequestTimeout(timeoutMillis)
            .setSocketTimeout(timeoutMillis)
            .build();
    HttpClientBuilder builder =
        HttpClients.custom()
            .setDefaultRequestConfig(requestConfig)
            .setUserAgent(TrinoClientConstants.USER_AGENT)
            .disableAutomaticRetries()
            .disableCookieManagement();
    if (context.isSsl()) {
      builder.setSSLContext(buildSslContext(context, authentication));
      if (!context.isSslVerificationEnabled()) {
        LOGGER.warn("TLS certificate verification is disabled for %s", context.getHost());
        builder.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
      }
    }
    RetryPolicy retryPolicy =
        new RetryPolicy(
            context.getMaxAttempts(), Duration.ofSeconds(context.getMaxRetryElapsedSeconds()));
    return new TrinoHttpClient(builder.build(), authentication, retryPolicy);
  }

  private static SSLContext buildSslContext(
      ITrinoConnectionContext context, IAuthenticationStrategy authentication)
      throws TrinoSQLException {
    SSLContextBuilder sslContextBuilder = SSLContexts.custom();
    try {
      if (!context.isSslVerificationEnabled()) {
        sslContextBuilder.loadTrustMaterial(TrustAllStrategy.INSTANCE);
      }
      authentication.configureSsl(sslContextBuilder);
      return sslContextBuilder.build();
    } catch (GeneralSecurityException e) {
      throw new TrinoConnectionException(
          "Cannot set up TLS: " + e.getMessage(), e, TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
  }
}
