package com.trino.client.auth;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.util.List;
import org.apache.http.Header;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;

/**
 * Kerberos through SPNEGO. Tokens are produced by a {@link GssNegotiator} for the principal
 * {@code <serviceName>@<host>} and sent as {@code Authorization: Negotiate <token>}, either
 * preemptively or once the server has answered with a {@code Negotiate} challenge.
 */
public class KerberosAuthentication implements IAuthenticationStrategy {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(KerberosAuthentication.class);
  private static final String NEGOTIATE_PREFIX = WwwAuthenticateParser.NEGOTIATE + " ";

  private final GssNegotiator negotiator;
  private final String serviceName;
  private final String clientPrincipal;
  private final boolean delegate;
  private volatile boolean negotiate;

  public KerberosAuthentication(
      GssNegotiator negotiator, String serviceName, String clientPrincipal, boolean delegate) {
    this.negotiator = checkNotNull(negotiator, "negotiator is null");
    this.serviceName = checkNotNull(serviceName, "serviceName is null");
    this.clientPrincipal = clientPrincipal;
    this.delegate = delegate;
    this.negotiate = delegate || negotiator.isPreemptive();
  }

  @Override
  public void prepare(HttpUriRequest request) throws TrinoSQLException {
    if (!negotiate) {
      return;
    }
    String servicePrincipal = serviceName + "@" + request.getURI().getHost();
    byte[] token = negotiator.initiate(servicePrincipal, clientPrincipal, delegate);
    request.setHeader(
        TrinoClientConstants.HEADER_AUTHORIZATION,
        NEGOTIATE_PREFIX + BaseEncoding.base64().encode(token));
  }

  @Override
  public boolean handleChallenge(
      HttpUriRequest request, TrinoHttpResponse response, CloseableHttpClient httpClient)
      throws TrinoSQLException {
    List<AuthChallenge> challenges =
        WwwAuthenticateParser.parse(
            response.getHeaders(TrinoClientConstants.HEADER_WWW_AUTHENTICATE));
    if (!WwwAuthenticateParser.strongest(
            challenges, ImmutableList.of(WwwAuthenticateParser.NEGOTIATE))
        .isPresent()) {
      throw new TrinoAuthenticationException(
          "Server did not offer a Negotiate challenge for Kerberos authentication");
    }
    Header sent = request.getFirstHeader(TrinoClientConstants.HEADER_AUTHORIZATION);
    if (sent != null && sent.getValue().startsWith(NEGOTIATE_PREFIX)) {
      // our token was rejected
      return false;
    }
    LOGGER.debug("Server requested Negotiate, switching to Kerberos tokens");
    negotiate = true;
    return true;
  }
}
