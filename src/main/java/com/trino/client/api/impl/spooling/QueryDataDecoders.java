package com.trino.client.api.impl.spooling;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import java.util.List;
import java.util.Map;

/** Registry of the spooling encodings this client can decode. */
public final class QueryDataDecoders {

  private static final Map<String, QueryDataDecoder> DECODERS =
      ImmutableMap.of(
          JsonQueryDataDecoder.ENCODING, new JsonQueryDataDecoder(),
          Lz4JsonQueryDataDecoder.ENCODING, new Lz4JsonQueryDataDecoder());

  private QueryDataDecoders() {}

  public static QueryDataDecoder forEncoding(String encoding) throws TrinoProtocolException {
    QueryDataDecoder decoder = encoding == null ? null : DECODERS.get(encoding);
    if (decoder == null) {
      throw new TrinoProtocolException(
          "Unsupported query data encoding: " + encoding,
          TrinoDriverErrorCode.UNSUPPORTED_ENCODING);
    }
    return decoder;
  }

  public static boolean isSupported(String encoding) {
    return DECODERS.containsKey(encoding);
  }

  public static List<String> supportedEncodings() {
    return ImmutableList.copyOf(DECODERS.keySet());
  }
}
