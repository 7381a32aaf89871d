package org.hypertrace.core.logquery.request;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Index statistics of the streams matching {@code matchers}; bounds have millisecond precision. */
@Value
@Builder(toBuilder = true)
public class IndexStatsQueryRequest implements LogQueryRequest {
  @NonNull Instant from;
  @NonNull Instant through;
  @NonNull String matchers;

  @Override
  public RequestKind getKind() {
    return RequestKind.INDEX_STATS;
  }

  @Override
  public String getQuery() {
    return matchers;
  }

  @Override
  public Instant getStart() {
    return from;
  }

  @Override
  public Instant getEnd() {
    return through;
  }

  @Override
  public long getStep() {
    return 0;
  }

  @Override
  public List<String> getShards() {
    return List.of();
  }

  @Override
  public String getPath() {
    return QueryRoute.INDEX_STATS.getPath();
  }

  @Override
  public CachingOptions getCachingOptions() {
    return CachingOptions.NO_CACHING;
  }

  @Override
  public IndexStatsQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().from(start).through(end).build();
  }

  @Override
  public IndexStatsQueryRequest withQuery(String query) {
    return toBuilder().matchers(query).build();
  }

  @Override
  public IndexStatsQueryRequest withShards(List<ShardSpec> shards) {
    return this;
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.of(
        "matchers", matchers,
        "start", from.toString(),
        "end", through.toString());
  }
}
