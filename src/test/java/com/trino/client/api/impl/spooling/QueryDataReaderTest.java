package com.trino.client.api.impl.spooling;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.JsonNode;
import com.trino.client.common.util.JsonUtil;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Factory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class QueryDataReaderTest {

  @Mock ITrinoHttpClient httpClient;
  private QueryDataReader reader;

  @BeforeEach
  void setUp() {
    reader = new QueryDataReader(new SegmentFetcher(httpClient));
  }

  private static JsonNode json(String text) throws Exception {
    return JsonUtil.getMapper().readTree(text);
  }

  private static String base64(byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }

  private static String inlineSegment(byte[] data, Long uncompressedSize) {
    String metadata =
        uncompressedSize == null
            ? "{\"rowOffset\":0}"
            : "{\"rowOffset\":0,\"uncompressedSize\":" + uncompressedSize + "}";
    return "{\"type\":\"inline\",\"data\":\"" + base64(data) + "\",\"metadata\":" + metadata + "}";
  }

  @Test
  void testInlineRowsArePassedThrough() throws Exception {
    JsonNode data = json("[[1,\"a\"],[2,\"b\"]]");
    assertSame(data, reader.read(data));
  }

  @Test
  void testMissingDataHasNoRows() throws Exception {
    assertNull(reader.read(null));
    assertNull(reader.read(json("null")));
  }

  @Test
  void testSegmentsAreConcatenatedInOrder() throws Exception {
    JsonNode data =
        json(
            "{\"encoding\":\"json\",\"segments\":["
                + inlineSegment("[[1],[2]]".getBytes(StandardCharsets.UTF_8), null)
                + ","
                + inlineSegment("[[3]]".getBytes(StandardCharsets.UTF_8), null)
                + "]}");

    JsonNode rows = reader.read(data);

    assertEquals(3, rows.size());
    assertEquals(1, rows.get(0).get(0).asInt());
    assertEquals(3, rows.get(2).get(0).asInt());
  }

  @Test
  void testLz4Segment() throws Exception {
    byte[] plain = "[[\"compressed\"],[\"rows\"]]".getBytes(StandardCharsets.UTF_8);
    LZ4Compressor compressor = LZ4Factory.fastestInstance().fastCompressor();
    byte[] compressed = compressor.compress(plain);

    JsonNode rows =
        reader.read(
            json(
                "{\"encoding\":\"json+lz4\",\"segments\":["
                    + inlineSegment(compressed, (long) plain.length)
                    + "]}"));

    assertEquals("rows", rows.get(1).get(0).asText());
  }

  @Test
  void testLz4SegmentWithoutSizeIsUncompressed() throws Exception {
    JsonNode rows =
        reader.read(
            json(
                "{\"encoding\":\"json+lz4\",\"segments\":["
                    + inlineSegment("[[7]]".getBytes(StandardCharsets.UTF_8), null)
                    + "]}"));

    assertEquals(7, rows.get(0).get(0).asInt());
  }

  @Test
  void testLz4SizeMismatchIsProtocolError() throws Exception {
    byte[] plain = "[[1]]".getBytes(StandardCharsets.UTF_8);
    byte[] compressed = LZ4Factory.fastestInstance().fastCompressor().compress(plain);
    JsonNode data =
        json(
            "{\"encoding\":\"json+lz4\",\"segments\":["
                + inlineSegment(compressed, (long) plain.length + 10)
                + "]}");

    assertThrows(TrinoProtocolException.class, () -> reader.read(data));
  }

  @Test
  void testUnsupportedEncodingIsProtocolError() throws Exception {
    JsonNode data =
        json(
            "{\"encoding\":\"arrow+zstd\",\"segments\":[{\"type\":\"spooled\","
                + "\"uri\":\"https://storage/1\"}]}");

    TrinoProtocolException e =
        assertThrows(TrinoProtocolException.class, () -> reader.read(data));

    assertEquals(TrinoDriverErrorCode.UNSUPPORTED_ENCODING, e.getInternalError());
    verifyNoInteractions(httpClient);
  }

  @Test
  void testNonArrayJsonSegmentIsProtocolError() throws Exception {
    JsonNode data =
        json(
            "{\"encoding\":\"json\",\"segments\":["
                + inlineSegment("{\"a\":1}".getBytes(StandardCharsets.UTF_8), null)
                + "]}");

    assertThrows(TrinoProtocolException.class, () -> reader.read(data));
  }

  @Test
  void testSupportedEncodings() {
    assertTrue(QueryDataDecoders.isSupported("json"));
    assertTrue(QueryDataDecoders.isSupported("json+lz4"));
    assertFalse(QueryDataDecoders.isSupported("json+zstd"));
    assertEquals(2, QueryDataDecoders.supportedEncodings().size());
  }
}
