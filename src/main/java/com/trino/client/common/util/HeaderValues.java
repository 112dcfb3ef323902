package com.trino.client.common.util;

import com.google.common.base.Splitter;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Helpers for the comma separated {@code name=value} lists used by protocol headers. */
public final class HeaderValues {

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  private HeaderValues() {}

  public static List<String> splitValues(String headerValue) {
    if (headerValue == null) {
      return new ArrayList<>();
    }
    return COMMA.splitToList(headerValue);
  }

  /** Parses {@code k1=v1,k2=v2}, url-decoding each value. */
  public static List<Map.Entry<String, String>> parseNameValues(String headerValue) {
    List<Map.Entry<String, String>> result = new ArrayList<>();
    for (String item : splitValues(headerValue)) {
      int eq = item.indexOf('=');
      if (eq < 0) {
        continue;
      }
      result.add(
          new AbstractMap.SimpleImmutableEntry<>(
              item.substring(0, eq).trim(), urlDecode(item.substring(eq + 1).trim())));
    }
    return result;
  }

  /** Form url-encoding: spaces become {@code +}. */
  public static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  /** Percent encoding where a space is {@code %20}. */
  public static String percentEncode(String value) {
    return urlEncode(value).replace("+", "%20");
  }

  public static String urlDecode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}
