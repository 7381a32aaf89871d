package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Metric query answer: a matrix, a vector or a scalar. */
@Value
@Builder(toBuilder = true)
public class PrometheusQueryResponse implements LogQueryResponse {
  public static final String RESULT_TYPE_MATRIX = "matrix";
  public static final String RESULT_TYPE_VECTOR = "vector";
  public static final String RESULT_TYPE_SCALAR = "scalar";

  @NonNull @Builder.Default String status = STATUS_SUCCESS;
  @NonNull String resultType;

  @Singular("sampleStream")
  List<SampleStream> result;

  String errorType;
  String error;
  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.PROMETHEUS;
  }

  @Override
  public PrometheusQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
