package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.logquery.api.QuantileSketchMatrix;

/** Quantile sketches of a quantile query. Only travels in the binary encoding. */
@Value
@Builder(toBuilder = true)
public class QuantileSketchesQueryResponse implements LogQueryResponse {
  @NonNull QuantileSketchMatrix data;
  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.QUANTILE_SKETCHES;
  }

  @Override
  public String getStatus() {
    return STATUS_SUCCESS;
  }

  @Override
  public QuantileSketchesQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
