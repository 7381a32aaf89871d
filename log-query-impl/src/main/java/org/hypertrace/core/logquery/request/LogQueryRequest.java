package org.hypertrace.core.logquery.request;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A decoded client query. Implementations are immutable; the {@code with*} methods return
 * modified copies so that one request can be split into sub-requests safely.
 *
 * <p>Operations that have no meaning for a variant return a fixed value: an empty query for series
 * requests, a zero step for everything but range and volume range requests.
 */
public interface LogQueryRequest {

  RequestKind getKind();

  /** LogQL query or matchers, empty when the variant has none. */
  String getQuery();

  Instant getStart();

  Instant getEnd();

  /** Step in milliseconds, zero when not applicable. */
  long getStep();

  /** Encoded shard assignment, see {@link ShardSpec#encode()}. */
  List<String> getShards();

  /** Path the request was received on, which decides the API version of the answer. */
  String getPath();

  CachingOptions getCachingOptions();

  LogQueryRequest withStartEnd(Instant start, Instant end);

  LogQueryRequest withQuery(String query);

  LogQueryRequest withShards(List<ShardSpec> shards);

  /** Key fields of the request in a stable order, for logging and tracing. */
  Map<String, String> describe();
}
