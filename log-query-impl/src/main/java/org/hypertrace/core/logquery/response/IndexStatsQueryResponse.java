package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class IndexStatsQueryResponse implements LogQueryResponse {
  long streams;
  long chunks;
  long bytes;
  long entries;
  @Singular List<QueryResponseHeader> headers;

  @Override
  public ResponseKind getKind() {
    return ResponseKind.INDEX_STATS;
  }

  @Override
  public String getStatus() {
    return STATUS_SUCCESS;
  }

  @Override
  public QueryStatistics getStatistics() {
    return QueryStatistics.EMPTY;
  }

  /** Field-wise sum; headers of this answer are kept. */
  public IndexStatsQueryResponse add(IndexStatsQueryResponse other) {
    return toBuilder()
        .streams(streams + other.streams)
        .chunks(chunks + other.chunks)
        .bytes(bytes + other.bytes)
        .entries(entries + other.entries)
        .build();
  }

  @Override
  public IndexStatsQueryResponse withHeaders(List<QueryResponseHeader> headers) {
    return toBuilder().clearHeaders().headers(headers).build();
  }
}
