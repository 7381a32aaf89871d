package org.hypertrace.core.logquery.response;

import io.grpc.StatusException;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.request.RangeQueryRequest;

/** Successful answers without data, used when a request needs no shard at all. */
public class EmptyResponses {

  public static LogQueryResponse forRequest(LogQueryRequest request) throws StatusException {
    switch (request.getKind()) {
      case SERIES:
        return SeriesQueryResponse.builder()
            .version(ApiVersion.fromPath(request.getPath()))
            .build();
      case LABEL:
        return LabelNamesQueryResponse.builder()
            .version(ApiVersion.fromPath(request.getPath()))
            .build();
      case INSTANT:
        // instant queries are always metric queries
        return PrometheusQueryResponse.builder()
            .resultType(PrometheusQueryResponse.RESULT_TYPE_VECTOR)
            .build();
      case RANGE:
        RangeQueryRequest range = (RangeQueryRequest) request;
        if (!isLogSelector(range.getQuery())) {
          return PrometheusQueryResponse.builder()
              .resultType(PrometheusQueryResponse.RESULT_TYPE_MATRIX)
              .build();
        }
        return StreamsQueryResponse.builder()
            .direction(range.getDirection())
            .limit(range.getLimit())
            .version(ApiVersion.fromPath(range.getPath()))
            .build();
      case INDEX_STATS:
        return IndexStatsQueryResponse.builder().build();
      case VOLUME:
        return VolumeQueryResponse.builder().build();
      default:
        throw LogQueryErrors.unsupportedKind("unsupported request kind " + request.getKind());
    }
  }

  /** Log queries start with a stream selector; metric queries start with an aggregation. */
  static boolean isLogSelector(String query) {
    return query.trim().startsWith("{");
  }
}
