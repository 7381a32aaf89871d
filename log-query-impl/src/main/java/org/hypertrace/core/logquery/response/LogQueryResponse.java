package org.hypertrace.core.logquery.response;

import java.util.List;

/** A decoded shard or merged answer. Implementations are immutable. */
public interface LogQueryResponse {
  String STATUS_SUCCESS = "success";

  ResponseKind getKind();

  String getStatus();

  /** HTTP headers that came with the answer; value order within a header is significant. */
  List<QueryResponseHeader> getHeaders();

  QueryStatistics getStatistics();

  LogQueryResponse withHeaders(List<QueryResponseHeader> headers);
}
