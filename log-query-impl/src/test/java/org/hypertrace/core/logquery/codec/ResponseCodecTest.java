package org.hypertrace.core.logquery.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.grpc.StatusException;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.LogQueryModule;
import org.hypertrace.core.logquery.api.HttpRequest;
import org.hypertrace.core.logquery.api.HttpResponse;
import org.hypertrace.core.logquery.api.TopKMatrix;
import org.hypertrace.core.logquery.api.util.LabelPairUtil;
import org.hypertrace.core.logquery.request.Direction;
import org.hypertrace.core.logquery.request.LabelQueryRequest;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.request.RangeQueryRequest;
import org.hypertrace.core.logquery.request.SeriesQueryRequest;
import org.hypertrace.core.logquery.request.VolumeQueryRequest;
import org.hypertrace.core.logquery.response.Entry;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.LogStream;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.QueryResponseHeader;
import org.hypertrace.core.logquery.response.Sample;
import org.hypertrace.core.logquery.response.SampleStream;
import org.hypertrace.core.logquery.response.SeriesIdentifier;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;
import org.hypertrace.core.logquery.response.SeriesQueryResponseView;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;
import org.hypertrace.core.logquery.response.TopKSketchesQueryResponse;
import org.hypertrace.core.logquery.response.Volume;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;
import org.junit.jupiter.api.Test;

class ResponseCodecTest {
  private static final HttpUrl FRONTEND = HttpUrl.get("http://query-frontend:3100");
  private static final MediaType JSON = MediaType.get(LogQueryHeaders.JSON_TYPE);

  private final ObjectMapper objectMapper = LogQueryModule.newObjectMapper();
  private final ResponseCodec codec = new ResponseCodec(objectMapper);

  @Test
  void decodesJsonStreams() throws Exception {
    StreamsQueryResponse response =
        (StreamsQueryResponse)
            codec.decodeResponse(
                shardResponse(200, JSON, fixture("streams_v1.json")), rangeRequest());

    assertEquals(Direction.FORWARD, response.getDirection());
    assertEquals(25, response.getLimit());
    assertEquals(1, response.getResult().size());
    LogStream stream = response.getResult().get(0);
    assertEquals("{app=\"foo\", env=\"prod\"}", stream.getLabels());
    assertEquals(
        Instant.ofEpochSecond(1_700_000_001L, 500), stream.getEntries().get(1).getTimestamp());
    assertEquals(
        Map.of("trace_id", "4bf92f3577b34da6"),
        stream.getEntries().get(1).getStructuredMetadata());
    assertEquals(2048, response.getStatistics().getSummary().getBytesProcessed());
    assertEquals(0.25, response.getStatistics().getSummary().getExecTime());
    assertEquals(1_500_000, response.getStatistics().getStore().getChunksDownloadTimeNanos());
  }

  @Test
  void decodesJsonMatrix() throws Exception {
    PrometheusQueryResponse response =
        (PrometheusQueryResponse)
            codec.decodeResponse(
                shardResponse(200, JSON, fixture("matrix.json")),
                rangeRequest().withQuery("sum(rate({app=\"foo\"}[1m]))"));

    assertEquals(PrometheusQueryResponse.RESULT_TYPE_MATRIX, response.getResultType());
    List<Sample> samples = response.getResult().get(0).getSamples();
    assertEquals(new Sample(1_700_000_000_500L, 1.5), samples.get(0));
    assertEquals(Double.POSITIVE_INFINITY, samples.get(1).getValue());
    assertEquals(1_700_000_002_123L, samples.get(2).getTimestampMs());
  }

  @Test
  void decodesJsonSeriesLabelsAndVolumes() throws Exception {
    SeriesQueryResponse series =
        (SeriesQueryResponse)
            codec.decodeResponse(
                shardResponse(200, JSON, fixture("series.json")), seriesRequest());
    LabelNamesQueryResponse labels =
        (LabelNamesQueryResponse)
            codec.decodeResponse(
                shardResponse(200, JSON, fixture("labels_legacy.json")),
                LabelQueryRequest.of(
                    Instant.ofEpochSecond(1), Instant.ofEpochSecond(2), "", "", "/api/prom/label"));
    VolumeQueryResponse volume =
        (VolumeQueryResponse)
            codec.decodeResponse(
                shardResponse(200, JSON, fixture("volume.json")),
                VolumeQueryRequest.builder()
                    .matchers("{app=~\".+\"}")
                    .from(Instant.ofEpochSecond(1))
                    .through(Instant.ofEpochSecond(2))
                    .build());

    assertEquals(SeriesIdentifier.of(Map.of("app", "bar")), series.getData().get(1));
    assertEquals(List.of("app", "env", "pod"), labels.getData());
    assertEquals(10, volume.getLimit());
    assertEquals(new Volume("{app=\"foo\"}", 38), volume.getVolumes().get(0));
  }

  @Test
  void relaysShardErrors() {
    StatusException exception =
        assertThrows(
            StatusException.class,
            () ->
                codec.decodeResponse(
                    shardResponse(429, JSON, "too many outstanding requests".getBytes()),
                    rangeRequest()));

    assertEquals(Status.Code.RESOURCE_EXHAUSTED, exception.getStatus().getCode());
    assertEquals("too many outstanding requests", exception.getStatus().getDescription());
    assertEquals(429, LogQueryErrors.httpStatusOf(exception));
  }

  @Test
  void rejectsUnknownResultTypes() {
    byte[] body = "{\"status\":\"success\",\"data\":{\"resultType\":\"foo\"}}".getBytes();

    StatusException exception =
        assertThrows(
            StatusException.class,
            () -> codec.decodeResponse(shardResponse(200, JSON, body), rangeRequest()));

    assertEquals(Status.Code.INTERNAL, exception.getStatus().getCode());
    assertEquals("unsupported response type, got (foo)", exception.getStatus().getDescription());
  }

  @Test
  void protobufAnswersDecodeToTheEncodedResponse() throws StatusException {
    StreamsQueryResponse streams =
        StreamsQueryResponse.builder()
            .direction(Direction.FORWARD)
            .limit(25)
            .stream(
                new LogStream(
                    "{app=\"foo\"}",
                    List.of(
                        Entry.builder()
                            .timestamp(Instant.ofEpochSecond(1_700_000_000L, 42))
                            .line("first")
                            .structuredMetadata(Map.of("trace_id", "abc"))
                            .build())))
            .build();

    Response encoded = codec.encodeResponse(clientRequest(true), streams);
    StreamsQueryResponse decoded =
        (StreamsQueryResponse) codec.decodeResponse(encoded, rangeRequest());

    assertEquals(LogQueryHeaders.PROTOBUF_TYPE, encoded.header(LogQueryHeaders.CONTENT_TYPE));
    assertEquals(streams.getResult(), decoded.getResult());
    assertEquals(streams.getStatistics(), decoded.getStatistics());
    assertEquals(Direction.FORWARD, decoded.getDirection());
  }

  @Test
  void protobufSeriesAnswersAreReadLazily() throws StatusException {
    SeriesQueryResponse series =
        SeriesQueryResponse.builder().series(SeriesIdentifier.of(Map.of("app", "foo"))).build();

    LogQueryResponse decoded =
        codec.decodeResponse(codec.encodeResponse(clientRequest(true), series), seriesRequest());

    SeriesQueryResponseView view = assertInstanceOf(SeriesQueryResponseView.class, decoded);
    assertEquals(series.getData(), view.materialize().getData());
  }

  @Test
  void rejectsProtobufAnswersOfTheWrongKind() throws StatusException {
    Response encoded =
        codec.encodeResponse(clientRequest(true), SeriesQueryResponse.builder().build());

    StatusException exception =
        assertThrows(
            StatusException.class,
            () ->
                codec.decodeResponse(
                    encoded,
                    LabelQueryRequest.of(
                        Instant.ofEpochSecond(1), Instant.ofEpochSecond(2), "", "", "/labels")));
    assertEquals(Status.Code.INTERNAL, exception.getStatus().getCode());
  }

  @Test
  void encodesMatrixAsJson() throws Exception {
    PrometheusQueryResponse matrix =
        PrometheusQueryResponse.builder()
            .resultType(PrometheusQueryResponse.RESULT_TYPE_MATRIX)
            .sampleStream(
                new SampleStream(
                    Map.of("job", "api"),
                    List.of(
                        new Sample(1_700_000_000_500L, 0.1),
                        new Sample(1_700_000_001_000L, Double.NaN))))
            .build();

    JsonNode body = readBody(codec.encodeResponse(clientRequest(false), matrix));

    JsonNode series = body.path("data").path("result").get(0);
    assertEquals("success", body.path("status").asText());
    assertEquals("matrix", body.path("data").path("resultType").asText());
    assertEquals("api", series.path("metric").path("job").asText());
    assertEquals(1_700_000_000.5, series.path("values").get(0).get(0).doubleValue());
    assertEquals("0.1", series.path("values").get(0).get(1).asText());
    assertEquals("NaN", series.path("values").get(1).get(1).asText());
    assertEquals(0, body.path("data").path("stats").path("summary").path("splits").asInt());
  }

  @Test
  void encodesStreamsWithCategorizedLabels() throws Exception {
    StreamsQueryResponse streams =
        StreamsQueryResponse.builder()
            .stream(
                new LogStream(
                    "{app=\"foo\"}",
                    List.of(
                        Entry.builder()
                            .timestamp(Instant.ofEpochSecond(1, 5))
                            .line("hello")
                            .structuredMetadata(Map.of("trace_id", "abc"))
                            .parsed(Map.of("level", "info"))
                            .build())))
            .build();
    Request request =
        clientRequest(false).newBuilder()
            .header(LogQueryHeaders.ENCODING_FLAGS, LogQueryHeaders.FLAG_CATEGORIZE_LABELS)
            .build();

    JsonNode data = readBody(codec.encodeResponse(request, streams)).path("data");

    assertEquals("categorize-labels", data.path("encodingFlags").get(0).asText());
    JsonNode value = data.path("result").get(0).path("values").get(0);
    assertEquals("1000000005", value.get(0).asText());
    assertEquals("hello", value.get(1).asText());
    assertEquals("abc", value.get(2).path("structuredMetadata").path("trace_id").asText());
    assertEquals("info", value.get(2).path("parsed").path("level").asText());
  }

  @Test
  void encodesLegacyStreamsAndLabels() throws Exception {
    Request legacy = new Request.Builder().url(FRONTEND.resolve("/api/prom/query")).build();
    StreamsQueryResponse streams =
        StreamsQueryResponse.builder()
            .stream(
                new LogStream(
                    "{app=\"foo\"}", List.of(Entry.of(Instant.parse("2024-01-01T00:00:00Z"), "x"))))
            .build();
    LabelNamesQueryResponse labels = LabelNamesQueryResponse.builder().name("app").build();

    JsonNode streamsBody = readBody(codec.encodeResponse(legacy, streams));
    JsonNode labelsBody = readBody(codec.encodeResponse(legacy, labels));

    JsonNode stream = streamsBody.path("streams").get(0);
    assertEquals("{app=\"foo\"}", stream.path("labels").asText());
    assertEquals("2024-01-01T00:00:00Z", stream.path("entries").get(0).path("ts").asText());
    assertEquals("app", labelsBody.path("values").get(0).asText());
  }

  @Test
  void passesResponseHeadersThrough() throws StatusException {
    SeriesQueryResponse series =
        SeriesQueryResponse.builder()
            .header(new QueryResponseHeader("X-Cache", List.of("hit")))
            .header(new QueryResponseHeader("content-type", List.of("text/plain")))
            .build();

    Response encoded = codec.encodeResponse(clientRequest(false), series);
    HttpResponse wrapped =
        codec.encodeHttpGrpcResponse(
            HttpRequest.newBuilder().setUrl("/loki/api/v1/series").build(), series);

    assertEquals("hit", encoded.header("X-Cache"));
    assertEquals(
        List.of(LogQueryHeaders.JSON_TYPE), encoded.headers(LogQueryHeaders.CONTENT_TYPE));
    assertEquals(200, wrapped.getCode());
    assertEquals(
        List.of(
            LabelPairUtil.createHttpHeader(
                LogQueryHeaders.CONTENT_TYPE, List.of(LogQueryHeaders.JSON_TYPE)),
            LabelPairUtil.createHttpHeader("X-Cache", List.of("hit"))),
        wrapped.getHeadersList());
  }

  @Test
  void decodesWrappedHttpResponses() throws StatusException {
    HttpResponse response =
        HttpResponse.newBuilder()
            .setCode(200)
            .addHeaders(
                LabelPairUtil.createHttpHeader(
                    LogQueryHeaders.CONTENT_TYPE, List.of(LogQueryHeaders.JSON_TYPE)))
            .setBody(ByteString.copyFromUtf8("{\"values\":[\"app\"]}"))
            .build();

    LabelNamesQueryResponse decoded =
        (LabelNamesQueryResponse)
            codec.decodeHttpGrpcResponse(
                response,
                LabelQueryRequest.of(
                    Instant.ofEpochSecond(1), Instant.ofEpochSecond(2), "", "", "/api/prom/label"));

    assertEquals(List.of("app"), decoded.getData());
  }

  @Test
  void sketchesOnlyTravelAsProtobuf() throws StatusException {
    TopKSketchesQueryResponse sketches =
        TopKSketchesQueryResponse.builder().data(TopKMatrix.getDefaultInstance()).build();

    StatusException exception =
        assertThrows(
            StatusException.class, () -> codec.encodeResponse(clientRequest(false), sketches));

    assertEquals(Status.Code.INTERNAL, exception.getStatus().getCode());
    assertEquals(
        LogQueryHeaders.PROTOBUF_TYPE,
        codec.encodeResponse(clientRequest(true), sketches).header(LogQueryHeaders.CONTENT_TYPE));
  }

  private static RangeQueryRequest rangeRequest() {
    return RangeQueryRequest.builder()
        .query("{app=\"foo\"}")
        .start(Instant.ofEpochSecond(1_700_000_000L))
        .end(Instant.ofEpochSecond(1_700_003_600L))
        .direction(Direction.FORWARD)
        .limit(25)
        .build();
  }

  private static LogQueryRequest seriesRequest() {
    return SeriesQueryRequest.builder()
        .matchGroup("{app=~\".+\"}")
        .start(Instant.ofEpochSecond(1))
        .end(Instant.ofEpochSecond(2))
        .build();
  }

  private static Request clientRequest(boolean protobuf) {
    Request.Builder builder =
        new Request.Builder().url(FRONTEND.resolve("/loki/api/v1/query_range"));
    if (protobuf) {
      builder.header(LogQueryHeaders.ACCEPT, LogQueryHeaders.PROTOBUF_TYPE);
    }
    return builder.build();
  }

  private static Response shardResponse(int code, MediaType type, byte[] body) {
    return new Response.Builder()
        .request(new Request.Builder().url(FRONTEND).build())
        .protocol(Protocol.HTTP_1_1)
        .code(code)
        .message("shard")
        .header(LogQueryHeaders.CONTENT_TYPE, type.toString())
        .body(ResponseBody.create(body, type))
        .build();
  }

  private JsonNode readBody(Response response) throws IOException {
    try (ResponseBody body = response.body()) {
      return objectMapper.readTree(body.bytes());
    }
  }

  private static byte[] fixture(String name) throws IOException {
    return Resources.toByteArray(Resources.getResource("responses/" + name));
  }
}
