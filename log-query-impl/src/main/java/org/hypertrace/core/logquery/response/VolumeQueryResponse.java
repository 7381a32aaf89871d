package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class VolumeQueryResponse implements LogQueryResponse {
  @Singular List<Volume> volumes;
  int limit;
  @Singular List<QueryResponseHeader> headers;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.VOLUME;
  }

  @Override
  public String getStatus() {
    return STATUS_SUCCESS;
  }

  @Override
  public QueryStatistics getStatistics() {
    return QueryStatistics.EMPTY;
  }

  @Override
  public VolumeQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
