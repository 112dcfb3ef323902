package com.trino.client.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.trino.client.exception.TrinoValidationException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class CompositeRedirectHandlerTest {

  @Test
  void testHandlersFromNames() throws Exception {
    CompositeRedirectHandler handler =
        CompositeRedirectHandler.fromNames(ImmutableList.of("open", " LOG ", "Print"));

    assertEquals(3, handler.getHandlers().size());
    assertTrue(handler.getHandlers().get(0) instanceof WebBrowserRedirectHandler);
    assertTrue(handler.getHandlers().get(1) instanceof ConsoleRedirectHandler);
    assertTrue(handler.getHandlers().get(2) instanceof ConsoleRedirectHandler);
  }

  @Test
  void testUnknownHandlerName() {
    assertThrows(
        TrinoValidationException.class,
        () -> CompositeRedirectHandler.fromNames(ImmutableList.of("OPEN", "EMAIL")));
  }

  @Test
  void testEveryHandlerIsInvoked() throws Exception {
    ByteArrayOutputStream first = new ByteArrayOutputStream();
    ByteArrayOutputStream second = new ByteArrayOutputStream();
    CompositeRedirectHandler handler =
        new CompositeRedirectHandler(
            ImmutableList.of(
                new ConsoleRedirectHandler(new PrintStream(first, true, "UTF-8")),
                new ConsoleRedirectHandler(new PrintStream(second, true, "UTF-8"))));

    handler.redirectTo(URI.create("https://coordinator/oauth2/token/initiate/abc"));

    assertTrue(
        first.toString(StandardCharsets.UTF_8.name())
            .contains("https://coordinator/oauth2/token/initiate/abc"));
    assertTrue(
        second.toString(StandardCharsets.UTF_8.name())
            .contains("https://coordinator/oauth2/token/initiate/abc"));
  }
}
