package com.trino.client.auth;

import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoValidationException;

/** Creates the authentication strategy configured for a connection. */
public final class AuthenticationStrategyFactory {

  private AuthenticationStrategyFactory() {}

  public static IAuthenticationStrategy create(ITrinoConnectionContext context)
      throws TrinoValidationException {
    switch (context.getAuthType()) {
      case NONE:
        return new NoAuthentication();
      case BASIC:
        return new BasicAuthentication(context.getUser(), context.getPassword());
      case JWT:
        return new BearerTokenAuthentication(required(context.getAccessToken(), "accessToken"));
      case CERTIFICATE:
        return new CertificateAuthentication(
            required(context.getKeyStorePath(), "keyStorePath"),
            context.getKeyStorePassword(),
            context.getKeyStoreType());
      case OAUTH2:
        return new OAuth2Authentication(
            CompositeRedirectHandler.fromNames(context.getRedirectHandlers()));
      case KERBEROS:
        return new KerberosAuthentication(
            new JgssNegotiator(),
            context.getKerberosServiceName(),
            context.getKerberosPrincipal(),
            context.isKerberosDelegate());
      default:
        throw new TrinoValidationException(
            "Unsupported authentication type: " + context.getAuthType(),
            TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
  }

  private static String required(String value, String name) throws TrinoValidationException {
    if (value == null || value.isEmpty()) {
      throw new TrinoValidationException(
          name + " is required for the configured authentication type",
          TrinoDriverErrorCode.INVALID_CONFIGURATION);
    }
    return value;
  }
}
