package com.trino.client.api.impl.spooling;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.trino.client.dbclient.ITrinoHttpClient;
import com.trino.client.dbclient.TrinoHttpResponse;
import com.trino.client.exception.TrinoConnectionException;
import com.trino.client.exception.TrinoDriverErrorCode;
import com.trino.client.exception.TrinoProtocolException;
import com.trino.client.model.core.QueryDataSegment;
import com.trino.client.model.core.SegmentMetadata;
import java.nio.charset.StandardCharsets;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class SegmentFetcherTest {

  private static final String SEGMENT_URI = "https://storage.example.com/segments/1";
  private static final String ACK_URI = "https://coordinator/v1/spooled/ack/1";

  @Mock ITrinoHttpClient httpClient;
  private SegmentFetcher fetcher;
  private final QueryDataDecoder decoder = new JsonQueryDataDecoder();

  @BeforeEach
  void setUp() {
    fetcher = new SegmentFetcher(httpClient);
  }

  private static TrinoHttpResponse response(int status, String body) {
    return new TrinoHttpResponse(
        status, ImmutableListMultimap.of(), body.getBytes(StandardCharsets.UTF_8));
  }

  private static QueryDataSegment spooled() {
    return new QueryDataSegment()
        .setType(QueryDataSegment.TYPE_SPOOLED)
        .setUri(SEGMENT_URI)
        .setAckUri(ACK_URI)
        .setHeaders(ImmutableMap.of("x-amz-server-side-encryption-key", ImmutableList.of("k1")))
        .setMetadata(new SegmentMetadata().setRowOffset(0L).setRowsCount(2L));
  }

  @Test
  void testSpooledSegmentIsDownloadedAndAcknowledged() throws Exception {
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "[[1],[2]]"));
    when(httpClient.executeOnce(any(HttpUriRequest.class))).thenReturn(response(204, ""));

    JsonNode rows = fetcher.fetch(spooled(), decoder);

    assertEquals(2, rows.size());
    assertEquals(2, rows.get(1).get(0).asInt());
    ArgumentCaptor<HttpUriRequest> download = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient).execute(download.capture());
    assertEquals(SEGMENT_URI, download.getValue().getURI().toString());
    assertEquals(
        "k1", download.getValue().getFirstHeader("x-amz-server-side-encryption-key").getValue());
    ArgumentCaptor<HttpUriRequest> ack = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient).executeOnce(ack.capture());
    assertTrue(ack.getValue() instanceof HttpPost);
    assertEquals(ACK_URI, ack.getValue().getURI().toString());
  }

  @Test
  void testAcknowledgementFailureDoesNotLoseRows() throws Exception {
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "[[\"a\"]]"));
    when(httpClient.executeOnce(any(HttpUriRequest.class)))
        .thenThrow(
            new TrinoConnectionException("reset", TrinoDriverErrorCode.CONNECTION_ERROR));

    JsonNode rows = fetcher.fetch(spooled(), decoder);

    assertEquals("a", rows.get(0).get(0).asText());
  }

  @Test
  void testSegmentWithoutAckUriIsNotAcknowledged() throws Exception {
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(200, "[]"));

    fetcher.fetch(spooled().setAckUri(null), decoder);

    verify(httpClient, never()).executeOnce(any(HttpUriRequest.class));
  }

  @Test
  void testFailedDownload() throws Exception {
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response(404, "expired"));

    TrinoProtocolException e =
        assertThrows(TrinoProtocolException.class, () -> fetcher.fetch(spooled(), decoder));

    assertEquals(TrinoDriverErrorCode.SEGMENT_DOWNLOAD_ERROR, e.getInternalError());
    verify(httpClient, never()).executeOnce(any(HttpUriRequest.class));
  }

  @Test
  void testInlineSegmentNeedsNoRequest() throws Exception {
    QueryDataSegment inline =
        new QueryDataSegment()
            .setType(QueryDataSegment.TYPE_INLINE)
            .setData("[[true]]".getBytes(StandardCharsets.UTF_8));

    JsonNode rows = fetcher.fetch(inline, decoder);

    assertTrue(rows.get(0).get(0).asBoolean());
    verifyNoInteractions(httpClient);
  }

  @Test
  void testUnknownSegmentType() {
    QueryDataSegment segment = new QueryDataSegment().setType("remote");
    assertThrows(TrinoProtocolException.class, () -> fetcher.fetch(segment, decoder));
  }
}
