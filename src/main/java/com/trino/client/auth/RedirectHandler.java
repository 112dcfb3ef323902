package com.trino.client.auth;

import com.trino.client.exception.TrinoSQLException;
import java.net.URI;

/** Sends the user to the identity provider during external authentication. */
public interface RedirectHandler {

  void redirectTo(URI uri) throws TrinoSQLException;
}
