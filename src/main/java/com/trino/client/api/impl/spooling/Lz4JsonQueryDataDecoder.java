package com.trino.client.api.impl.spooling;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.exception.TrinoSQLException;
import com.trino.client.model.core.SegmentMetadata;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/**
 * The {@code json+lz4} encoding: JSON rows compressed as a raw LZ4 block. Segments without an
 * {@code uncompressedSize} were too small to be worth compressing and are plain JSON.
 */
public class Lz4JsonQueryDataDecoder implements QueryDataDecoder {

  public static final String ENCODING = "json+lz4";

  private static final LZ4SafeDecompressor DECOMPRESSOR =
      LZ4Factory.fastestInstance().safeDecompressor();

  private final JsonQueryDataDecoder jsonDecoder = new JsonQueryDataDecoder();

  @Override
  public String getEncoding() {
    return ENCODING;
  }

  @Override
  public JsonNode decode(byte[] data, SegmentMetadata metadata) throws TrinoSQLException {
    Long uncompressedSize = metadata == null ? null : metadata.getUncompressedSize();
    if (uncompressedSize == null) {
      return jsonDecoder.decode(data, metadata);
    }
    if (uncompressedSize < 0 || uncompressedSize > Integer.MAX_VALUE) {
      throw new TrinoProtocolException("Invalid uncompressed segment size: " + uncompressedSize);
    }
    byte[] uncompressed = new byte[uncompressedSize.intValue()];
    int length;
    try {
      length = DECOMPRESSOR.decompress(data, 0, data.length, uncompressed, 0);
    } catch (LZ4Exception e) {
      throw new TrinoProtocolException("Corrupt LZ4 segment: " + e.getMessage(), e);
    }
    if (length != uncompressed.length) {
      throw new TrinoProtocolException(
          String.format(
              "LZ4 segment decompressed to %d bytes, expected %d", length, uncompressed.length));
    }
    return jsonDecoder.decode(uncompressed, metadata);
  }
}
