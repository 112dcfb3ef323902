package com.trino.client.api.impl;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.trino.client.api.internal.ITrinoConnectionContext;
import com.trino.client.common.TrinoClientConstants;
import com.trino.client.common.TrinoJdbcUrlParams;
import com.trino.client.common.util.HeaderValues;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Builds {@link ITrinoConnectionContext} instances from URLs of the form {@code
 * trino://host[:port][/catalog[/schema]][?key=value&...]}. Properties override URL parameters.
 */
public class TrinoConnectionContextFactory {

  private TrinoConnectionContextFactory() {}

  public static ITrinoConnectionContext create(String url, Properties properties)
      throws TrinoValidationException {
    URI uri = parseUri(url);
    Map<String, String> parameters = new HashMap<>();

    String path = uri.getRawPath();
    if (!Strings.isNullOrEmpty(path) && !"/".equals(path)) {
      List<String> segments = Splitter.on('/').omitEmptyStrings().splitToList(path);
      if (segments.size() > 2) {
        throw invalidUrl(url, "too many path segments");
      }
      parameters.put(
          TrinoJdbcUrlParams.CATALOG.getParamName(), HeaderValues.urlDecode(segments.get(0)));
      if (segments.size() == 2) {
        parameters.put(
            TrinoJdbcUrlParams.SCHEMA.getParamName(), HeaderValues.urlDecode(segments.get(1)));
      }
    }

    String query = uri.getRawQuery();
    if (!Strings.isNullOrEmpty(query)) {
      for (String pair : Splitter.on('&').omitEmptyStrings().split(query)) {
        int eq = pair.indexOf('=');
        if (eq <= 0) {
          throw invalidUrl(url, "malformed parameter " + pair);
        }
        parameters.put(
            HeaderValues.urlDecode(pair.substring(0, eq)),
            HeaderValues.urlDecode(pair.substring(eq + 1)));
      }
    }

    if (properties != null) {
      for (String name : properties.stringPropertyNames()) {
        parameters.put(name, properties.getProperty(name));
      }
    }
    return new TrinoConnectionContext(uri.getHost(), uri.getPort(), parameters);
  }

  public static ITrinoConnectionContext create(String url) throws TrinoValidationException {
    return create(url, new Properties());
  }

  private static URI parseUri(String url) throws TrinoValidationException {
    if (url == null || !url.startsWith(TrinoClientConstants.URL_SCHEME + "://")) {
      throw invalidUrl(url, "expected " + TrinoClientConstants.URL_SCHEME + ":// prefix");
    }
    try {
      return new URI(url);
    } catch (URISyntaxException e) {
      throw new TrinoValidationException("Invalid connection URL: " + url, e);
    }
  }

  private static TrinoValidationException invalidUrl(String url, String detail) {
    return new TrinoValidationException(
        String.format("Invalid connection URL %s: %s", url, detail),
        TrinoDriverErrorCode.INVALID_CONFIGURATION);
  }
}
