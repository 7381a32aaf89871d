package org.hypertrace.core.logquery.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.StatusException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.labels.LabelSets;
import org.hypertrace.core.logquery.response.Entry;
import org.hypertrace.core.logquery.response.IndexStatsQueryResponse;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.LogStream;
import org.hypertrace.core.logquery.response.MergedSeriesQueryResponseView;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.QueryStatistics;
import org.hypertrace.core.logquery.response.Sample;
import org.hypertrace.core.logquery.response.SampleStream;
import org.hypertrace.core.logquery.response.SeriesIdentifier;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;
import org.hypertrace.core.logquery.response.SeriesQueryResponseView;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;
import org.hypertrace.core.logquery.response.Volume;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;

/**
 * Writes response variants as the JSON bodies served to clients. Stream and label answers have a
 * legacy and a v1 shape; the {@code categorize-labels} flag moves structured metadata and parsed
 * labels of each entry into separate objects.
 */
@Slf4j
public class JsonResponseEncoder {
  private static final DateTimeFormatter LEGACY_TIMESTAMP_FORMAT =
      DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

  private final ObjectMapper objectMapper;

  public JsonResponseEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] encode(LogQueryResponse response, ApiVersion version, boolean categorizeLabels)
      throws StatusException {
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    try (JsonGenerator generator = objectMapper.getFactory().createGenerator(output)) {
      write(generator, response, version, categorizeLabels);
    } catch (IOException | IllegalArgumentException e) {
      throw LogQueryErrors.internal("could not encode response: " + e.getMessage(), e);
    }
    log.debug("Encoded {} response into {} bytes of json", response.getKind(), output.size());
    return output.toByteArray();
  }

  private void write(
      JsonGenerator generator,
      LogQueryResponse response,
      ApiVersion version,
      boolean categorizeLabels)
      throws IOException, StatusException {
    switch (response.getKind()) {
      case PROMETHEUS:
        writePrometheus(generator, (PrometheusQueryResponse) response);
        break;
      case STREAMS:
        if (version == ApiVersion.LEGACY) {
          writeLegacyStreams(generator, (StreamsQueryResponse) response);
        } else {
          writeStreams(generator, (StreamsQueryResponse) response, categorizeLabels);
        }
        break;
      case SERIES:
        writeSeries(generator, (SeriesQueryResponse) response);
        break;
      case SERIES_VIEW:
        writeSeriesView(generator, response.getStatus(), (SeriesQueryResponseView) response);
        break;
      case MERGED_SERIES_VIEW:
        writeSeriesView(
            generator,
            response.getStatus(),
            ((MergedSeriesQueryResponseView) response).uniqueSeries());
        break;
      case LABEL_NAMES:
        writeLabels(generator, (LabelNamesQueryResponse) response);
        break;
      case INDEX_STATS:
        writeIndexStats(generator, (IndexStatsQueryResponse) response);
        break;
      case VOLUME:
        writeVolume(generator, (VolumeQueryResponse) response);
        break;
      default:
        throw LogQueryErrors.internal("invalid response format, got " + response.getKind());
    }
  }

  private void writePrometheus(JsonGenerator generator, PrometheusQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    generator.writeStringField("status", response.getStatus());
    if (response.getErrorType() != null) {
      generator.writeStringField("errorType", response.getErrorType());
    }
    if (response.getError() != null) {
      generator.writeStringField("error", response.getError());
    }
    generator.writeObjectFieldStart("data");
    generator.writeStringField("resultType", response.getResultType());
    generator.writeFieldName("result");
    switch (response.getResultType()) {
      case PrometheusQueryResponse.RESULT_TYPE_SCALAR:
        List<Sample> scalar =
            response.getResult().isEmpty()
                ? List.of()
                : response.getResult().get(0).getSamples();
        if (scalar.isEmpty()) {
          generator.writeStartArray();
          generator.writeEndArray();
        } else {
          writeSample(generator, scalar.get(0));
        }
        break;
      case PrometheusQueryResponse.RESULT_TYPE_VECTOR:
        generator.writeStartArray();
        for (SampleStream stream : response.getResult()) {
          generator.writeStartObject();
          writeLabelMap(generator, "metric", stream.getLabels());
          if (!stream.getSamples().isEmpty()) {
            generator.writeFieldName("value");
            writeSample(generator, stream.getSamples().get(0));
          }
          generator.writeEndObject();
        }
        generator.writeEndArray();
        break;
      default:
        generator.writeStartArray();
        for (SampleStream stream : response.getResult()) {
          generator.writeStartObject();
          writeLabelMap(generator, "metric", stream.getLabels());
          generator.writeArrayFieldStart("values");
          for (Sample sample : stream.getSamples()) {
            writeSample(generator, sample);
          }
          generator.writeEndArray();
          generator.writeEndObject();
        }
        generator.writeEndArray();
    }
    writeStatistics(generator, response.getStatistics());
    generator.writeEndObject();
    generator.writeEndObject();
  }

  private void writeStreams(
      JsonGenerator generator, StreamsQueryResponse response, boolean categorizeLabels)
      throws IOException {
    generator.writeStartObject();
    generator.writeStringField("status", response.getStatus());
    generator.writeObjectFieldStart("data");
    generator.writeStringField("resultType", StreamsQueryResponse.RESULT_TYPE_STREAMS);
    if (categorizeLabels) {
      generator.writeArrayFieldStart("encodingFlags");
      generator.writeString(LogQueryHeaders.FLAG_CATEGORIZE_LABELS);
      generator.writeEndArray();
    }
    generator.writeArrayFieldStart("result");
    for (LogStream stream : response.getResult()) {
      generator.writeStartObject();
      writeLabelMap(generator, "stream", LabelSets.parse(stream.getLabels()));
      generator.writeArrayFieldStart("values");
      for (Entry entry : stream.getEntries()) {
        generator.writeStartArray();
        generator.writeString(String.valueOf(toNanos(entry.getTimestamp())));
        generator.writeString(entry.getLine());
        if (categorizeLabels) {
          if (!entry.getStructuredMetadata().isEmpty() || !entry.getParsed().isEmpty()) {
            generator.writeStartObject();
            if (!entry.getStructuredMetadata().isEmpty()) {
              writeLabelMap(generator, "structuredMetadata", entry.getStructuredMetadata());
            }
            if (!entry.getParsed().isEmpty()) {
              writeLabelMap(generator, "parsed", entry.getParsed());
            }
            generator.writeEndObject();
          }
        } else if (!entry.getStructuredMetadata().isEmpty()) {
          writeLabelMap(generator, null, entry.getStructuredMetadata());
        }
        generator.writeEndArray();
      }
      generator.writeEndArray();
      generator.writeEndObject();
    }
    generator.writeEndArray();
    writeStatistics(generator, response.getStatistics());
    generator.writeEndObject();
    generator.writeEndObject();
  }

  private void writeLegacyStreams(JsonGenerator generator, StreamsQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    generator.writeArrayFieldStart("streams");
    for (LogStream stream : response.getResult()) {
      generator.writeStartObject();
      generator.writeStringField("labels", stream.getLabels());
      generator.writeArrayFieldStart("entries");
      for (Entry entry : stream.getEntries()) {
        generator.writeStartObject();
        generator.writeStringField("ts", LEGACY_TIMESTAMP_FORMAT.format(entry.getTimestamp()));
        generator.writeStringField("line", entry.getLine());
        generator.writeEndObject();
      }
      generator.writeEndArray();
      generator.writeEndObject();
    }
    generator.writeEndArray();
    writeStatistics(generator, response.getStatistics());
    generator.writeEndObject();
  }

  private void writeSeries(JsonGenerator generator, SeriesQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    generator.writeStringField("status", response.getStatus());
    generator.writeArrayFieldStart("data");
    for (SeriesIdentifier series : response.getData()) {
      writeLabelMap(generator, null, series.getLabels());
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private void writeSeriesView(
      JsonGenerator generator,
      String status,
      Iterable<SeriesQueryResponseView.SeriesIdentifierView> identifiers)
      throws IOException {
    generator.writeStartObject();
    generator.writeStringField("status", status);
    generator.writeArrayFieldStart("data");
    for (SeriesQueryResponseView.SeriesIdentifierView identifier : identifiers) {
      generator.writeStartObject();
      for (Map.Entry<String, String> label : identifier.labels()) {
        generator.writeStringField(label.getKey(), label.getValue());
      }
      generator.writeEndObject();
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private void writeLabels(JsonGenerator generator, LabelNamesQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    if (response.getVersion() == ApiVersion.LEGACY) {
      generator.writeArrayFieldStart("values");
    } else {
      generator.writeStringField("status", response.getStatus());
      generator.writeArrayFieldStart("data");
    }
    for (String name : response.getData()) {
      generator.writeString(name);
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private void writeIndexStats(JsonGenerator generator, IndexStatsQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    generator.writeNumberField("streams", response.getStreams());
    generator.writeNumberField("chunks", response.getChunks());
    generator.writeNumberField("bytes", response.getBytes());
    generator.writeNumberField("entries", response.getEntries());
    generator.writeEndObject();
  }

  private void writeVolume(JsonGenerator generator, VolumeQueryResponse response)
      throws IOException {
    generator.writeStartObject();
    generator.writeArrayFieldStart("volumes");
    for (Volume volume : response.getVolumes()) {
      generator.writeStartObject();
      generator.writeStringField("name", volume.getName());
      generator.writeNumberField("volume", volume.getVolume());
      generator.writeEndObject();
    }
    generator.writeEndArray();
    generator.writeNumberField("limit", response.getLimit());
    generator.writeEndObject();
  }

  private void writeStatistics(JsonGenerator generator, QueryStatistics statistics)
      throws IOException {
    generator.writeFieldName("stats");
    objectMapper.writeValue(generator, statistics);
  }

  /** Writes {@code [<seconds>, "<value>"]}, seconds keeping millisecond precision. */
  private static void writeSample(JsonGenerator generator, Sample sample) throws IOException {
    generator.writeStartArray();
    generator.writeNumber(BigDecimal.valueOf(sample.getTimestampMs(), 3));
    generator.writeString(formatValue(sample.getValue()));
    generator.writeEndArray();
  }

  static String formatValue(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static void writeLabelMap(
      JsonGenerator generator, String fieldName, Map<String, String> labels) throws IOException {
    if (fieldName == null) {
      generator.writeStartObject();
    } else {
      generator.writeObjectFieldStart(fieldName);
    }
    for (Map.Entry<String, String> label : labels.entrySet()) {
      generator.writeStringField(label.getKey(), label.getValue());
    }
    generator.writeEndObject();
  }

  private static long toNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }
}
