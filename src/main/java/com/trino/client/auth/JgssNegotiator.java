package com.trino.client.auth;

import com.trino.client.exception.TrinoAuthenticationException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import org.ietf.jgss.GSSContext;
import org.ietf.jgss.GSSCredential;
import org.ietf.jgss.GSSException;
import org.ietf.jgss.GSSManager;
import org.ietf.jgss.GSSName;
import org.ietf.jgss.Oid;

/** SPNEGO through {@code org.ietf.jgss}. Credentials come from the JAAS login or ticket cache. */
public class JgssNegotiator implements GssNegotiator {

  private static final TrinoLogger LOGGER = TrinoLoggerFactory.getLogger(JgssNegotiator.class);

  static final String SPNEGO_OID = "1.3.6.1.5.5.2";

  private final GSSManager manager;

  public JgssNegotiator() {
    this(GSSManager.getInstance());
  }

  JgssNegotiator(GSSManager manager) {
    this.manager = manager;
  }

  @Override
  public byte[] initiate(String servicePrincipal, String clientPrincipal, boolean delegate)
      throws TrinoSQLException {
    GSSContext context = null;
    try {
      Oid spnego = new Oid(SPNEGO_OID);
      GSSName service = manager.createName(servicePrincipal, GSSName.NT_HOSTBASED_SERVICE);
      GSSCredential credential = null;
      if (clientPrincipal != null) {
        GSSName client = manager.createName(clientPrincipal, GSSName.NT_USER_NAME);
        credential =
            manager.createCredential(
                client, GSSCredential.DEFAULT_LIFETIME, spnego, GSSCredential.INITIATE_ONLY);
      }
      context = manager.createContext(service, spnego, credential, GSSContext.DEFAULT_LIFETIME);
      context.requestMutualAuth(true);
      context.requestCredDeleg(delegate);
      return context.initSecContext(new byte[0], 0, 0);
    } catch (GSSException e) {
      throw new TrinoAuthenticationException(
          "Kerberos negotiation failed for " + servicePrincipal + ": " + e.getMessage(), e);
    } finally {
      if (context != null) {
        try {
          context.dispose();
        } catch (GSSException e) {
          LOGGER.debug("Failed to dispose GSS context: %s", e.getMessage());
        }
      }
    }
  }
}
