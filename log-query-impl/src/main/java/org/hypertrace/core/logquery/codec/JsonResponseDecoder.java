package org.hypertrace.core.logquery.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.StatusException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.labels.LabelSets;
import org.hypertrace.core.logquery.params.QueryParams;
import org.hypertrace.core.logquery.params.QueryParamsAdapter;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.response.Entry;
import org.hypertrace.core.logquery.response.IndexStatsQueryResponse;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.LogStream;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.QueryResponseHeader;
import org.hypertrace.core.logquery.response.QueryStatistics;
import org.hypertrace.core.logquery.response.Sample;
import org.hypertrace.core.logquery.response.SampleStream;
import org.hypertrace.core.logquery.response.SeriesIdentifier;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;
import org.hypertrace.core.logquery.response.Volume;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;

/**
 * Reads shard answers in the JSON encoding. Series, label, index stats and volume answers have a
 * fixed shape per request kind; query answers are dispatched on {@code data.resultType}.
 */
@Slf4j
public class JsonResponseDecoder {
  private final ObjectMapper objectMapper;

  public JsonResponseDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public LogQueryResponse decode(
      byte[] body, LogQueryRequest request, List<QueryResponseHeader> headers)
      throws StatusException {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw LogQueryErrors.internal("error decoding response: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw LogQueryErrors.internal("error decoding response: expected a json object");
    }
    try {
      return decode(root, request, headers);
    } catch (IllegalArgumentException e) {
      throw LogQueryErrors.internal("error decoding response: " + e.getMessage(), e);
    }
  }

  private LogQueryResponse decode(
      JsonNode root, LogQueryRequest request, List<QueryResponseHeader> headers)
      throws StatusException {
    ApiVersion version = ApiVersion.fromPath(request.getPath());
    switch (request.getKind()) {
      case SERIES:
        return decodeSeries(root, version, headers);
      case LABEL:
        return decodeLabels(root, version, headers);
      case INDEX_STATS:
        return IndexStatsQueryResponse.builder()
            .streams(root.path("streams").asLong())
            .chunks(root.path("chunks").asLong())
            .bytes(root.path("bytes").asLong())
            .entries(root.path("entries").asLong())
            .headers(headers)
            .build();
      case VOLUME:
        return decodeVolume(root, headers);
      case RANGE:
      case INSTANT:
        return decodeQuery(root, request, version, headers);
      default:
        throw LogQueryErrors.unsupportedKind("unsupported request kind " + request.getKind());
    }
  }

  private SeriesQueryResponse decodeSeries(
      JsonNode root, ApiVersion version, List<QueryResponseHeader> headers) {
    SeriesQueryResponse.SeriesQueryResponseBuilder builder =
        SeriesQueryResponse.builder()
            .status(root.path("status").asText())
            .version(version)
            .headers(headers);
    for (JsonNode series : root.path("data")) {
      builder.series(SeriesIdentifier.of(labelMap(series)));
    }
    return builder.build();
  }

  private LabelNamesQueryResponse decodeLabels(
      JsonNode root, ApiVersion version, List<QueryResponseHeader> headers) {
    JsonNode names = root.has("data") ? root.path("data") : root.path("values");
    LabelNamesQueryResponse.LabelNamesQueryResponseBuilder builder =
        LabelNamesQueryResponse.builder()
            .status(root.path("status").asText(LogQueryResponse.STATUS_SUCCESS))
            .version(version)
            .headers(headers);
    for (JsonNode name : names) {
      builder.name(name.asText());
    }
    return builder.build();
  }

  private VolumeQueryResponse decodeVolume(JsonNode root, List<QueryResponseHeader> headers) {
    VolumeQueryResponse.VolumeQueryResponseBuilder builder =
        VolumeQueryResponse.builder().limit(root.path("limit").asInt()).headers(headers);
    for (JsonNode volume : root.path("volumes")) {
      builder.volume(new Volume(volume.path("name").asText(), volume.path("volume").asLong()));
    }
    return builder.build();
  }

  private LogQueryResponse decodeQuery(
      JsonNode root, LogQueryRequest request, ApiVersion version, List<QueryResponseHeader> headers)
      throws StatusException {
    String status = root.path("status").asText();
    JsonNode data = root.path("data");
    String resultType = data.path("resultType").asText();
    QueryStatistics statistics = statistics(data.path("stats"));
    JsonNode result = data.path("result");
    log.debug("Decoding json {} answer of a {} request", resultType, request.getKind());
    switch (resultType) {
      case PrometheusQueryResponse.RESULT_TYPE_MATRIX:
        return PrometheusQueryResponse.builder()
            .status(status)
            .resultType(resultType)
            .result(matrix(result))
            .headers(headers)
            .statistics(statistics)
            .build();
      case PrometheusQueryResponse.RESULT_TYPE_VECTOR:
        return PrometheusQueryResponse.builder()
            .status(status)
            .resultType(resultType)
            .result(vector(result))
            .headers(headers)
            .statistics(statistics)
            .build();
      case PrometheusQueryResponse.RESULT_TYPE_SCALAR:
        return PrometheusQueryResponse.builder()
            .status(status)
            .resultType(resultType)
            .sampleStream(new SampleStream(Map.of(), List.of(sample(result))))
            .headers(headers)
            .statistics(statistics)
            .build();
      case StreamsQueryResponse.RESULT_TYPE_STREAMS:
        QueryParams params = QueryParamsAdapter.adapt(request);
        return StreamsQueryResponse.builder()
            .status(status)
            .direction(params.getDirection())
            .limit(params.getLimit())
            .version(version)
            .result(streams(result))
            .headers(headers)
            .statistics(statistics)
            .build();
      default:
        throw LogQueryErrors.internal("unsupported response type, got (" + resultType + ")");
    }
  }

  private QueryStatistics statistics(JsonNode stats) throws StatusException {
    if (stats.isMissingNode() || stats.isNull()) {
      return QueryStatistics.EMPTY;
    }
    try {
      return objectMapper.treeToValue(stats, QueryStatistics.class);
    } catch (JsonProcessingException e) {
      throw LogQueryErrors.internal("error decoding response statistics: " + e.getMessage(), e);
    }
  }

  private static List<SampleStream> matrix(JsonNode result) {
    List<SampleStream> streams = new ArrayList<>();
    for (JsonNode series : result) {
      List<Sample> samples = new ArrayList<>();
      for (JsonNode value : series.path("values")) {
        samples.add(sample(value));
      }
      streams.add(new SampleStream(labelMap(series.path("metric")), samples));
    }
    return streams;
  }

  private static List<SampleStream> vector(JsonNode result) {
    List<SampleStream> streams = new ArrayList<>();
    for (JsonNode series : result) {
      streams.add(
          new SampleStream(labelMap(series.path("metric")), List.of(sample(series.path("value")))));
    }
    return streams;
  }

  private static List<LogStream> streams(JsonNode result) {
    List<LogStream> streams = new ArrayList<>();
    for (JsonNode stream : result) {
      List<Entry> entries = new ArrayList<>();
      for (JsonNode value : stream.path("values")) {
        Entry.EntryBuilder entry =
            Entry.builder()
                .timestamp(Instant.ofEpochSecond(0, Long.parseLong(value.path(0).asText("0"))))
                .line(value.path(1).asText());
        JsonNode metadata = value.path(2);
        if (metadata.has("structuredMetadata") || metadata.has("parsed")) {
          entry
              .structuredMetadata(labelMap(metadata.path("structuredMetadata")))
              .parsed(labelMap(metadata.path("parsed")));
        } else if (metadata.isObject()) {
          entry.structuredMetadata(labelMap(metadata));
        }
        entries.add(entry.build());
      }
      streams.add(new LogStream(LabelSets.format(labelMap(stream.path("stream"))), entries));
    }
    return streams;
  }

  /** Reads {@code [<seconds>, "<value>"]} into a millisecond sample. */
  private static Sample sample(JsonNode pair) {
    JsonNode timestamp = pair.path(0);
    BigDecimal seconds =
        timestamp.isNumber() ? timestamp.decimalValue() : new BigDecimal(timestamp.asText("0"));
    long timestampMs = seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValue();
    return new Sample(timestampMs, parseValue(pair.path(1).asText()));
  }

  static double parseValue(String value) {
    switch (value) {
      case "+Inf":
      case "Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.parseDouble(value);
    }
  }

  private static Map<String, String> labelMap(JsonNode node) {
    Map<String, String> labels = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      labels.put(field.getKey(), field.getValue().asText());
    }
    return labels;
  }
}
