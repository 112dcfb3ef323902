package com.trino.client.auth;

import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.io.PrintStream;
import java.net.URI;

/** Prints the redirect URL so the user can open it by hand. */
public class ConsoleRedirectHandler implements RedirectHandler {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(ConsoleRedirectHandler.class);

  private final PrintStream out;

  public ConsoleRedirectHandler() {
    this(System.out);
  }

  public ConsoleRedirectHandler(PrintStream out) {
    this.out = out;
  }

  @Override
  public void redirectTo(URI uri) {
    LOGGER.info("External authentication required, redirect URL: %s", uri);
    out.println("Open the following URL in browser for the external authentication:");
    out.println(uri);
    out.flush();
  }
}
