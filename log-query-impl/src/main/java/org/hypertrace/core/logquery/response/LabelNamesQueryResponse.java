package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.logquery.ApiVersion;

/** Label names, or the values of one label. */
@Value
@Builder(toBuilder = true)
public class LabelNamesQueryResponse implements LogQueryResponse {
  @NonNull @Builder.Default String status = STATUS_SUCCESS;
  @NonNull @Builder.Default ApiVersion version = ApiVersion.V1;

  @Singular("name")
  List<String> data;

  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.LABEL_NAMES;
  }

  @Override
  public LabelNamesQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
