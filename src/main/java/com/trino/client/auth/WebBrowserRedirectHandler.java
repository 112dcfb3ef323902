package com.trino.client.auth;

import com.trino.client.log.TrinoLogger;
import com.trino.client.log.TrinoLoggerFactory;
import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;

/** Opens the redirect URL in the desktop browser, when the platform has one. */
public class WebBrowserRedirectHandler implements RedirectHandler {

  private static final TrinoLogger LOGGER =
      TrinoLoggerFactory.getLogger(WebBrowserRedirectHandler.class);

  @Override
  public void redirectTo(URI uri) {
    if (!Desktop.isDesktopSupported()
        || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
      LOGGER.warn("Desktop browsing is not supported on this platform");
      return;
    }
    try {
      Desktop.getDesktop().browse(uri);
    } catch (IOException | UnsupportedOperationException e) {
      LOGGER.warn("Failed to open browser automatically: %s", e.getMessage());
    }
  }
}
