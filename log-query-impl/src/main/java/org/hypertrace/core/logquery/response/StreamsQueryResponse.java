package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.request.Direction;

@Value
@Builder(toBuilder = true)
public class StreamsQueryResponse implements LogQueryResponse {
  public static final String RESULT_TYPE_STREAMS = "streams";

  @NonNull @Builder.Default String status = STATUS_SUCCESS;
  @NonNull @Builder.Default Direction direction = Direction.BACKWARD;
  int limit;
  @NonNull @Builder.Default ApiVersion version = ApiVersion.V1;

  @Singular("stream")
  List<LogStream> result;

  String errorType;
  String error;
  @Singular List<QueryResponseHeader> headers;
  @NonNull @Builder.Default QueryStatistics statistics = QueryStatistics.EMPTY;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.STREAMS;
  }

  /** Number of entries across all streams. */
  public long count() {
    return result.stream().mapToLong(stream -> stream.getEntries().size()).sum();
  }

  @Override
  public StreamsQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
