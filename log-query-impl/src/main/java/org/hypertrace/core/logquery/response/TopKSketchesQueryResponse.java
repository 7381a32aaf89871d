package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.logquery.api.TopKMatrix;

/** Count-min sketches of a top-k query. Only travels in the binary encoding. */
@Value
@Builder(toBuilder = true)
public class TopKSketchesQueryResponse implements LogQueryResponse {
  @NonNull TopKMatrix data;
  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.TOPK_SKETCHES;
  }

  @Override
  public String getStatus() {
    return STATUS_SUCCESS;
  }

  @Override
  public TopKSketchesQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
