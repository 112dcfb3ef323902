package com.trino.client.common.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared Jackson mapper. Configured once and safe to use from any thread. */
public final class JsonUtil {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JsonUtil() {}

  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
