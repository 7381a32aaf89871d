package org.hypertrace.core.logquery.codec;

import static org.hypertrace.core.logquery.api.util.LabelPairUtil.createResponseHeader;
import static org.hypertrace.core.logquery.api.util.LabelPairUtil.fromMap;
import static org.hypertrace.core.logquery.api.util.LabelPairUtil.toMap;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import io.grpc.StatusException;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.api.IndexStatsResponse;
import org.hypertrace.core.logquery.api.LabelNamesResponse;
import org.hypertrace.core.logquery.api.PrometheusResponse;
import org.hypertrace.core.logquery.api.QuantileSketchesResponse;
import org.hypertrace.core.logquery.api.QueryResponse;
import org.hypertrace.core.logquery.api.ResponseHeader;
import org.hypertrace.core.logquery.api.SeriesResponse;
import org.hypertrace.core.logquery.api.Stream;
import org.hypertrace.core.logquery.api.StreamsResponse;
import org.hypertrace.core.logquery.api.TopKSketchesResponse;
import org.hypertrace.core.logquery.api.VolumeResponse;
import org.hypertrace.core.logquery.request.Direction;
import org.hypertrace.core.logquery.response.Entry;
import org.hypertrace.core.logquery.response.IndexStatsQueryResponse;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.LogStream;
import org.hypertrace.core.logquery.response.MergedSeriesQueryResponseView;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.QuantileSketchesQueryResponse;
import org.hypertrace.core.logquery.response.QueryResponseHeader;
import org.hypertrace.core.logquery.response.QueryStatistics;
import org.hypertrace.core.logquery.response.Sample;
import org.hypertrace.core.logquery.response.SampleStream;
import org.hypertrace.core.logquery.response.SeriesIdentifier;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;
import org.hypertrace.core.logquery.response.SeriesQueryResponseView;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;
import org.hypertrace.core.logquery.response.TopKSketchesQueryResponse;
import org.hypertrace.core.logquery.response.Volume;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;

/** Converts response variants to and from the binary {@link QueryResponse} envelope. */
public class ProtobufResponseConverter {

  /** Encodes a response into envelope bytes. Series views are copied without being decoded. */
  public static byte[] encode(LogQueryResponse response) throws StatusException {
    switch (response.getKind()) {
      case SERIES_VIEW:
        SeriesQueryResponseView view = (SeriesQueryResponseView) response;
        return encodeSeriesView(view.getStatus(), view.getVersion(), view.getStatistics(), view);
      case MERGED_SERIES_VIEW:
        MergedSeriesQueryResponseView merged = (MergedSeriesQueryResponseView) response;
        return encodeSeriesView(
            merged.getStatus(),
            merged.getVersion(),
            merged.getStatistics(),
            merged.uniqueSeries());
      default:
        return wrap(response).toByteArray();
    }
  }

  public static QueryResponse wrap(LogQueryResponse response) throws StatusException {
    QueryResponse.Builder envelope = QueryResponse.newBuilder();
    switch (response.getKind()) {
      case PROMETHEUS:
        return envelope.setProm(toProto((PrometheusQueryResponse) response)).build();
      case STREAMS:
        return envelope.setStreams(toProto((StreamsQueryResponse) response)).build();
      case SERIES:
        return envelope.setSeries(toProto((SeriesQueryResponse) response)).build();
      case SERIES_VIEW:
        return envelope
            .setSeries(toProto(((SeriesQueryResponseView) response).materialize()))
            .build();
      case MERGED_SERIES_VIEW:
        return envelope
            .setSeries(toProto(((MergedSeriesQueryResponseView) response).materialize()))
            .build();
      case LABEL_NAMES:
        return envelope.setLabels(toProto((LabelNamesQueryResponse) response)).build();
      case INDEX_STATS:
        return envelope.setStats(toProto((IndexStatsQueryResponse) response)).build();
      case VOLUME:
        return envelope.setVolume(toProto((VolumeQueryResponse) response)).build();
      case TOPK_SKETCHES:
        TopKSketchesQueryResponse topK = (TopKSketchesQueryResponse) response;
        return envelope
            .setTopkSketches(
                TopKSketchesResponse.newBuilder()
                    .setData(topK.getData())
                    .addAllHeaders(toProtoHeaders(topK.getHeaders()))
                    .setStatistics(topK.getStatistics().toProto()))
            .build();
      case QUANTILE_SKETCHES:
        QuantileSketchesQueryResponse quantiles = (QuantileSketchesQueryResponse) response;
        return envelope
            .setQuantileSketches(
                QuantileSketchesResponse.newBuilder()
                    .setData(quantiles.getData())
                    .addAllHeaders(toProtoHeaders(quantiles.getHeaders()))
                    .setStatistics(quantiles.getStatistics().toProto()))
            .build();
      default:
        throw LogQueryErrors.internal("invalid response format, got " + response.getKind());
    }
  }

  /**
   * Converts the envelope content into a response variant. {@code headers} replace any headers
   * stored inside the envelope when not empty.
   *
   * @throws StatusException INTERNAL if the envelope is empty
   */
  public static LogQueryResponse unwrap(QueryResponse envelope, List<QueryResponseHeader> headers)
      throws StatusException {
    LogQueryResponse response;
    switch (envelope.getResponseCase()) {
      case PROM:
        response = fromProto(envelope.getProm());
        break;
      case STREAMS:
        response = fromProto(envelope.getStreams());
        break;
      case SERIES:
        response = fromProto(envelope.getSeries());
        break;
      case LABELS:
        response = fromProto(envelope.getLabels());
        break;
      case STATS:
        response = fromProto(envelope.getStats());
        break;
      case VOLUME:
        response = fromProto(envelope.getVolume());
        break;
      case TOPK_SKETCHES:
        TopKSketchesResponse topK = envelope.getTopkSketches();
        response =
            TopKSketchesQueryResponse.builder()
                .data(topK.getData())
                .headers(fromProtoHeaders(topK.getHeadersList()))
                .statistics(QueryStatistics.fromProto(topK.getStatistics()))
                .build();
        break;
      case QUANTILE_SKETCHES:
        QuantileSketchesResponse quantiles = envelope.getQuantileSketches();
        response =
            QuantileSketchesQueryResponse.builder()
                .data(quantiles.getData())
                .headers(fromProtoHeaders(quantiles.getHeadersList()))
                .statistics(QueryStatistics.fromProto(quantiles.getStatistics()))
                .build();
        break;
      default:
        throw LogQueryErrors.internal(
            "unsupported response type, got " + envelope.getResponseCase());
    }
    return headers.isEmpty() ? response : response.withHeaders(headers);
  }

  static PrometheusResponse toProto(PrometheusQueryResponse response) {
    PrometheusResponse.Builder builder =
        PrometheusResponse.newBuilder()
            .setStatus(response.getStatus())
            .setResultType(response.getResultType())
            .addAllHeaders(toProtoHeaders(response.getHeaders()))
            .setStatistics(response.getStatistics().toProto());
    if (response.getErrorType() != null) {
      builder.setErrorType(response.getErrorType());
    }
    if (response.getError() != null) {
      builder.setError(response.getError());
    }
    for (SampleStream stream : response.getResult()) {
      builder.addResult(
          org.hypertrace.core.logquery.api.SampleStream.newBuilder()
              .addAllLabels(fromMap(stream.getLabels()))
              .addAllSamples(
                  stream.getSamples().stream()
                      .map(
                          sample ->
                              org.hypertrace.core.logquery.api.Sample.newBuilder()
                                  .setTimestampMs(sample.getTimestampMs())
                                  .setValue(sample.getValue())
                                  .build())
                      .collect(Collectors.toList())));
    }
    return builder.build();
  }

  static PrometheusQueryResponse fromProto(PrometheusResponse response) {
    PrometheusQueryResponse.PrometheusQueryResponseBuilder builder =
        PrometheusQueryResponse.builder()
            .status(response.getStatus())
            .resultType(response.getResultType())
            .errorType(emptyToNull(response.getErrorType()))
            .error(emptyToNull(response.getError()))
            .headers(fromProtoHeaders(response.getHeadersList()))
            .statistics(QueryStatistics.fromProto(response.getStatistics()));
    for (org.hypertrace.core.logquery.api.SampleStream stream : response.getResultList()) {
      builder.sampleStream(
          new SampleStream(
              toMap(stream.getLabelsList()),
              stream.getSamplesList().stream()
                  .map(sample -> new Sample(sample.getTimestampMs(), sample.getValue()))
                  .collect(Collectors.toList())));
    }
    return builder.build();
  }

  static StreamsResponse toProto(StreamsQueryResponse response) {
    StreamsResponse.Builder builder =
        StreamsResponse.newBuilder()
            .setStatus(response.getStatus())
            .setDirection(response.getDirection().toProto())
            .setLimit(response.getLimit())
            .setVersion(response.getVersion().getValue())
            .addAllHeaders(toProtoHeaders(response.getHeaders()))
            .setStatistics(response.getStatistics().toProto());
    if (response.getErrorType() != null) {
      builder.setErrorType(response.getErrorType());
    }
    if (response.getError() != null) {
      builder.setError(response.getError());
    }
    for (LogStream stream : response.getResult()) {
      Stream.Builder protoStream = Stream.newBuilder().setLabels(stream.getLabels());
      for (Entry entry : stream.getEntries()) {
        protoStream.addEntries(
            org.hypertrace.core.logquery.api.Entry.newBuilder()
                .setTimestampNanos(toNanos(entry.getTimestamp()))
                .setLine(entry.getLine())
                .addAllStructuredMetadata(fromMap(entry.getStructuredMetadata()))
                .addAllParsed(fromMap(entry.getParsed())));
      }
      builder.addResult(protoStream);
    }
    return builder.build();
  }

  static StreamsQueryResponse fromProto(StreamsResponse response) {
    StreamsQueryResponse.StreamsQueryResponseBuilder builder =
        StreamsQueryResponse.builder()
            .status(response.getStatus())
            .direction(Direction.fromProto(response.getDirection()))
            .limit(response.getLimit())
            .version(ApiVersion.fromValue(response.getVersion()))
            .errorType(emptyToNull(response.getErrorType()))
            .error(emptyToNull(response.getError()))
            .headers(fromProtoHeaders(response.getHeadersList()))
            .statistics(QueryStatistics.fromProto(response.getStatistics()));
    for (Stream stream : response.getResultList()) {
      builder.stream(
          new LogStream(
              stream.getLabels(),
              stream.getEntriesList().stream()
                  .map(
                      entry ->
                          Entry.builder()
                              .timestamp(fromNanos(entry.getTimestampNanos()))
                              .line(entry.getLine())
                              .structuredMetadata(toMap(entry.getStructuredMetadataList()))
                              .parsed(toMap(entry.getParsedList()))
                              .build())
                  .collect(Collectors.toList())));
    }
    return builder.build();
  }

  static SeriesResponse toProto(SeriesQueryResponse response) {
    return SeriesResponse.newBuilder()
        .setStatus(response.getStatus())
        .setVersion(response.getVersion().getValue())
        .addAllData(
            response.getData().stream()
                .map(
                    series ->
                        org.hypertrace.core.logquery.api.SeriesIdentifier.newBuilder()
                            .addAllLabels(fromMap(series.getLabels()))
                            .build())
                .collect(Collectors.toList()))
        .addAllHeaders(toProtoHeaders(response.getHeaders()))
        .setStatistics(response.getStatistics().toProto())
        .build();
  }

  static SeriesQueryResponse fromProto(SeriesResponse response) {
    return SeriesQueryResponse.builder()
        .status(response.getStatus())
        .version(ApiVersion.fromValue(response.getVersion()))
        .data(
            response.getDataList().stream()
                .map(series -> SeriesIdentifier.of(toMap(series.getLabelsList())))
                .collect(Collectors.toList()))
        .headers(fromProtoHeaders(response.getHeadersList()))
        .statistics(QueryStatistics.fromProto(response.getStatistics()))
        .build();
  }

  static LabelNamesResponse toProto(LabelNamesQueryResponse response) {
    return LabelNamesResponse.newBuilder()
        .setStatus(response.getStatus())
        .setVersion(response.getVersion().getValue())
        .addAllData(response.getData())
        .addAllHeaders(toProtoHeaders(response.getHeaders()))
        .setStatistics(response.getStatistics().toProto())
        .build();
  }

  static LabelNamesQueryResponse fromProto(LabelNamesResponse response) {
    return LabelNamesQueryResponse.builder()
        .status(response.getStatus())
        .version(ApiVersion.fromValue(response.getVersion()))
        .data(response.getDataList())
        .headers(fromProtoHeaders(response.getHeadersList()))
        .statistics(QueryStatistics.fromProto(response.getStatistics()))
        .build();
  }

  static IndexStatsResponse toProto(IndexStatsQueryResponse response) {
    return IndexStatsResponse.newBuilder()
        .setStreams(response.getStreams())
        .setChunks(response.getChunks())
        .setBytes(response.getBytes())
        .setEntries(response.getEntries())
        .addAllHeaders(toProtoHeaders(response.getHeaders()))
        .build();
  }

  static IndexStatsQueryResponse fromProto(IndexStatsResponse response) {
    return IndexStatsQueryResponse.builder()
        .streams(response.getStreams())
        .chunks(response.getChunks())
        .bytes(response.getBytes())
        .entries(response.getEntries())
        .headers(fromProtoHeaders(response.getHeadersList()))
        .build();
  }

  static VolumeResponse toProto(VolumeQueryResponse response) {
    return VolumeResponse.newBuilder()
        .addAllVolumes(
            response.getVolumes().stream()
                .map(
                    volume ->
                        org.hypertrace.core.logquery.api.Volume.newBuilder()
                            .setName(volume.getName())
                            .setVolume(volume.getVolume())
                            .build())
                .collect(Collectors.toList()))
        .setLimit(response.getLimit())
        .addAllHeaders(toProtoHeaders(response.getHeaders()))
        .build();
  }

  static VolumeQueryResponse fromProto(VolumeResponse response) {
    return VolumeQueryResponse.builder()
        .volumes(
            response.getVolumesList().stream()
                .map(volume -> new Volume(volume.getName(), volume.getVolume()))
                .collect(Collectors.toList()))
        .limit(response.getLimit())
        .headers(fromProtoHeaders(response.getHeadersList()))
        .build();
  }

  static List<ResponseHeader> toProtoHeaders(List<QueryResponseHeader> headers) {
    return headers.stream()
        .map(header -> createResponseHeader(header.getName(), header.getValues()))
        .collect(Collectors.toList());
  }

  static List<QueryResponseHeader> fromProtoHeaders(List<ResponseHeader> headers) {
    return headers.stream()
        .map(header -> new QueryResponseHeader(header.getName(), header.getValuesList()))
        .collect(Collectors.toList());
  }

  private static byte[] encodeSeriesView(
      String status,
      int version,
      QueryStatistics statistics,
      Iterable<SeriesQueryResponseView.SeriesIdentifierView> identifiers)
      throws StatusException {
    try {
      ByteString.Output series = ByteString.newOutput();
      CodedOutputStream seriesOutput = CodedOutputStream.newInstance(series);
      seriesOutput.writeString(SeriesResponse.STATUS_FIELD_NUMBER, status);
      for (SeriesQueryResponseView.SeriesIdentifierView identifier : identifiers) {
        seriesOutput.writeBytes(SeriesResponse.DATA_FIELD_NUMBER, identifier.toByteString());
      }
      seriesOutput.writeUInt32(SeriesResponse.VERSION_FIELD_NUMBER, version);
      seriesOutput.writeMessage(SeriesResponse.STATISTICS_FIELD_NUMBER, statistics.toProto());
      seriesOutput.flush();

      ByteString.Output envelope = ByteString.newOutput();
      CodedOutputStream envelopeOutput = CodedOutputStream.newInstance(envelope);
      envelopeOutput.writeBytes(QueryResponse.SERIES_FIELD_NUMBER, series.toByteString());
      envelopeOutput.flush();
      return envelope.toByteString().toByteArray();
    } catch (IOException e) {
      throw LogQueryErrors.internal("could not marshal protobuf: " + e.getMessage(), e);
    }
  }

  private static long toNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }

  private static Instant fromNanos(long nanos) {
    return Instant.ofEpochSecond(0, nanos);
  }

  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }
}
