package org.hypertrace.core.logquery.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpShardTransportTest {
  private MockWebServer server;
  private OkHttpShardTransport transport;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    transport = new OkHttpShardTransport(new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void completesWithTheShardAnswer() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setHeader(LogQueryHeaders.CONTENT_TYPE, LogQueryHeaders.JSON_TYPE)
            .setBody("{\"status\":\"success\",\"data\":[\"app\"]}"));
    Request request =
        new Request.Builder()
            .url(server.url("/loki/api/v1/labels?start=1&end=2"))
            .header(LogQueryHeaders.ORG_ID, "tenant-1")
            .build();

    try (Response response = transport.execute(request).get(5, TimeUnit.SECONDS)) {
      assertEquals(200, response.code());
      assertEquals("{\"status\":\"success\",\"data\":[\"app\"]}", response.body().string());
    }
    RecordedRequest recorded = server.takeRequest(5, TimeUnit.SECONDS);
    assertEquals("/loki/api/v1/labels?start=1&end=2", recorded.getPath());
    assertEquals("tenant-1", recorded.getHeader(LogQueryHeaders.ORG_ID));
  }

  @Test
  void completesWithErrorStatusesToo() throws Exception {
    server.enqueue(
        new MockResponse().setResponseCode(429).setBody("too many outstanding requests"));

    try (Response response =
        transport
            .execute(new Request.Builder().url(server.url("/loki/api/v1/query")).build())
            .get(5, TimeUnit.SECONDS)) {
      assertEquals(429, response.code());
    }
  }

  @Test
  void failsWhenNoAnswerArrives() {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

    ExecutionException exception =
        assertThrows(
            ExecutionException.class,
            () ->
                transport
                    .execute(new Request.Builder().url(server.url("/loki/api/v1/query")).build())
                    .get(5, TimeUnit.SECONDS));
    assertInstanceOf(IOException.class, exception.getCause());
  }
}
