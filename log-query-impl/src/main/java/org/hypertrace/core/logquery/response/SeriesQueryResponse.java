package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.logquery.ApiVersion;

@Value
@Builder(toBuilder = true)
public class SeriesQueryResponse implements LogQueryResponse {
  @NonNull @Builder.Default String status = STATUS_SUCCESS;
  @NonNull @Builder.Default ApiVersion version = ApiVersion.V1;

  @Singular("series")
  List<SeriesIdentifier> data;

  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.SERIES;
  }

  @Override
  public SeriesQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
