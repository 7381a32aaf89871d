package org.hypertrace.core.logquery.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import io.grpc.Status;
import io.grpc.StatusException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.logquery.LogQueryConfig;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.LogQueryModule;
import org.hypertrace.core.logquery.QueryContext;
import org.hypertrace.core.logquery.codec.HttpQueryParser;
import org.hypertrace.core.logquery.codec.RequestCodec;
import org.hypertrace.core.logquery.codec.ResponseCodec;
import org.hypertrace.core.logquery.merge.ResponseMerger;
import org.hypertrace.core.logquery.request.IndexStatsQueryRequest;
import org.hypertrace.core.logquery.request.LabelQueryRequest;
import org.hypertrace.core.logquery.response.IndexStatsQueryResponse;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ShardedQueryExecutorTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final QueryContext TENANT = QueryContext.forTenant("tenant-1");

  @Mock private ShardTransport transport;

  private MeterRegistry meterRegistry;
  private ShardedQueryExecutor executor;

  @BeforeEach
  void setUp() {
    LogQueryConfig config =
        new LogQueryConfig(ConfigFactory.load().getConfig("service.config"));
    meterRegistry = new SimpleMeterRegistry();
    executor =
        new ShardedQueryExecutor(
            new RequestCodec(
                new HttpQueryParser(
                    50,
                    config.getQueryDefaultsConfig().getLookback(),
                    Clock.fixed(START, ZoneOffset.UTC)),
                config.getShardClientConfig().getEndpoint()),
            new ResponseCodec(LogQueryModule.newObjectMapper()),
            new ResponseMerger(),
            transport,
            meterRegistry,
            config);
  }

  @Test
  void mergesShardAnswersInSubRequestOrder() {
    Map<String, String> answers =
        Map.of(
            "{a=\"1\"}", "{\"status\":\"success\",\"data\":[\"app\",\"env\"]}",
            "{a=\"2\"}", "{\"status\":\"success\",\"data\":[\"pod\",\"app\"]}");
    when(transport.execute(any()))
        .thenAnswer(
            invocation -> {
              Request request = invocation.getArgument(0);
              return CompletableFuture.completedFuture(
                  json(request, 200, answers.get(request.url().queryParameter("query"))));
            });

    LogQueryResponse merged =
        executor
            .execute(List.of(labels("{a=\"1\"}"), labels("{a=\"2\"}")), TENANT)
            .blockingGet();

    assertEquals(List.of("app", "env", "pod"), ((LabelNamesQueryResponse) merged).getData());
    assertEquals(2.0, shardRequests("false"));
    assertEquals(0.0, shardRequests("true"));
  }

  @Test
  void sumsIndexStatsOfEveryShard() {
    when(transport.execute(any()))
        .thenAnswer(
            invocation ->
                CompletableFuture.completedFuture(
                    json(
                        invocation.getArgument(0),
                        200,
                        "{\"streams\":1,\"chunks\":2,\"bytes\":300,\"entries\":4}")));
    IndexStatsQueryRequest request =
        IndexStatsQueryRequest.builder()
            .from(START.minusSeconds(3600))
            .through(START)
            .matchers("{app=\"foo\"}")
            .build();

    IndexStatsQueryResponse merged =
        (IndexStatsQueryResponse)
            executor.execute(List.of(request, request, request), TENANT).blockingGet();

    assertEquals(3, merged.getStreams());
    assertEquals(900, merged.getBytes());
  }

  @Test
  void failsTheQueryWhenAShardFails() {
    when(transport.execute(any()))
        .thenAnswer(
            invocation -> {
              Request request = invocation.getArgument(0);
              if ("{a=\"2\"}".equals(request.url().queryParameter("query"))) {
                return CompletableFuture.completedFuture(
                    json(request, 429, "too many outstanding requests"));
              }
              return CompletableFuture.completedFuture(
                  json(request, 200, "{\"status\":\"success\",\"data\":[\"app\"]}"));
            });

    executor
        .execute(List.of(labels("{a=\"1\"}"), labels("{a=\"2\"}")), TENANT)
        .test()
        .assertError(
            error ->
                error instanceof StatusException
                    && ((StatusException) error).getStatus().getCode()
                        == Status.Code.RESOURCE_EXHAUSTED);
    assertEquals(1.0, shardRequests("true"));
  }

  @Test
  void closesAnswersArrivingAfterTheQueryFailed() {
    CompletableFuture<Response> slowShard = new CompletableFuture<>();
    AtomicReference<Request> slowRequest = new AtomicReference<>();
    when(transport.execute(any()))
        .thenAnswer(
            invocation -> {
              Request request = invocation.getArgument(0);
              if ("{a=\"1\"}".equals(request.url().queryParameter("query"))) {
                slowRequest.set(request);
                return slowShard;
              }
              return CompletableFuture.completedFuture(
                  json(request, 429, "too many outstanding requests"));
            });

    executor
        .execute(List.of(labels("{a=\"1\"}"), labels("{a=\"2\"}")), TENANT)
        .test()
        .assertError(StatusException.class);
    ResponseBody body =
        spy(
            ResponseBody.create(
                "{\"status\":\"success\",\"data\":[\"app\"]}",
                MediaType.get(LogQueryHeaders.JSON_TYPE)));
    slowShard.complete(
        new Response.Builder()
            .request(slowRequest.get())
            .protocol(Protocol.HTTP_1_1)
            .code(200)
            .message("OK")
            .body(body)
            .build());

    verify(body).close();
  }

  @Test
  void propagatesTransportFailures() {
    when(transport.execute(any()))
        .thenReturn(CompletableFuture.failedFuture(new IOException("connection refused")));

    executor
        .execute(List.of(labels("{a=\"1\"}")), TENANT)
        .test()
        .assertError(IOException.class);
    assertEquals(1.0, shardRequests("true"));
  }

  @Test
  void rejectsRequestsWithoutTenantBeforeCallingShards() {
    executor
        .execute(List.of(labels("{a=\"1\"}")), QueryContext.EMPTY)
        .test()
        .assertError(
            error ->
                ((StatusException) error).getStatus().getCode() == Status.Code.UNAUTHENTICATED);
    verify(transport, never()).execute(any());
  }

  @Test
  void rejectsEmptyQueries() {
    executor
        .execute(List.of(), TENANT)
        .test()
        .assertError(
            error ->
                ((StatusException) error).getStatus().getCode() == Status.Code.INVALID_ARGUMENT);
  }

  private double shardRequests(String error) {
    return meterRegistry
        .get(ShardedQueryExecutor.SHARD_REQUESTS_COUNTER)
        .tag("error", error)
        .counter()
        .count();
  }

  private static LabelQueryRequest labels(String query) {
    return LabelQueryRequest.of(
        START.minusSeconds(3600), START, query, "", "/loki/api/v1/labels");
  }

  private static Response json(Request request, int code, String body) {
    return new Response.Builder()
        .request(request)
        .protocol(Protocol.HTTP_1_1)
        .code(code)
        .message("status " + code)
        .header(LogQueryHeaders.CONTENT_TYPE, LogQueryHeaders.JSON_TYPE)
        .body(ResponseBody.create(body, MediaType.get(LogQueryHeaders.JSON_TYPE)))
        .build();
  }
}
