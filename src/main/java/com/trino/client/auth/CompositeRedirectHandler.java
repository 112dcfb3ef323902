package com.trino.client.auth;

import com.google.common.collect.ImmutableList;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.exception.TrinoValidationException;
import java.net.URI;
import java.util.List;
import java.util.Locale;

/** Runs several redirect handlers in order. */
public class CompositeRedirectHandler implements RedirectHandler {

  private final List<RedirectHandler> handlers;

  public CompositeRedirectHandler(List<RedirectHandler> handlers) {
    this.handlers = ImmutableList.copyOf(handlers);
  }

  /**
   * Builds a handler from names as used by {@code externalAuthenticationRedirectHandlers}: {@code
   * OPEN} opens the browser, {@code LOG} (or {@code PRINT}) prints the URL.
   */
  public static CompositeRedirectHandler fromNames(List<String> names)
      throws TrinoValidationException {
    ImmutableList.Builder<RedirectHandler> handlers = ImmutableList.builder();
    for (String name : names) {
      switch (name.trim().toUpperCase(Locale.ROOT)) {
        case "OPEN":
          handlers.add(new WebBrowserRedirectHandler());
          break;
        case "LOG":
        case "PRINT":
          handlers.add(new ConsoleRedirectHandler());
          break;
        default:
          throw new TrinoValidationException("Unknown redirect handler: " + name);
      }
    }
    return new CompositeRedirectHandler(handlers.build());
  }

  public List<RedirectHandler> getHandlers() {
    return handlers;
  }

  @Override
  public void redirectTo(URI uri) throws TrinoSQLException {
    for (RedirectHandler handler : handlers) {
      handler.redirectTo(uri);
    }
  }
}
