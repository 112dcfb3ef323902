package com.trino.client.dbclient;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/** A fully buffered HTTP response. Header names are matched case-insensitively. */
public class TrinoHttpResponse {

  private final int statusCode;
  private final ListMultimap<String, String> headers;
  private final byte[] body;

  public TrinoHttpResponse(int statusCode, ListMultimap<String, String> headers, byte[] body) {
    this.statusCode = statusCode;
    ImmutableListMultimap.Builder<String, String> normalized = ImmutableListMultimap.builder();
    headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
    this.headers = normalized.build();
    this.body = body == null ? new byte[0] : body;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** First value of the header, or null. */
  public String getHeader(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    return values.isEmpty() ? null : values.get(0);
  }

  /** Every value of the header, in the order received. */
  public List<String> getHeaders(String name) {
    return ImmutableList.copyOf(headers.get(name.toLowerCase(Locale.ROOT)));
  }

  public ListMultimap<String, String> getAllHeaders() {
    return headers;
  }

  public byte[] getBody() {
    return body;
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
