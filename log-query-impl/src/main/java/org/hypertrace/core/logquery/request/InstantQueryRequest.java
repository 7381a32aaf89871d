package org.hypertrace.core.logquery.request;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Query evaluated at a single instant, which serves as both bounds. */
@Value
@Builder(toBuilder = true)
public class InstantQueryRequest implements LogQueryRequest {
  @NonNull String query;
  @NonNull Instant time;
  @NonNull @Builder.Default Direction direction = Direction.BACKWARD;
  int limit;
  @Singular List<String> shards;
  @NonNull @Builder.Default String path = QueryRoute.INSTANT_QUERY.getPath();

  @Override
  public RequestKind getKind() {
    return RequestKind.INSTANT;
  }

  @Override
  public Instant getStart() {
    return time;
  }

  @Override
  public Instant getEnd() {
    return time;
  }

  @Override
  public long getStep() {
    return 0;
  }

  @Override
  public CachingOptions getCachingOptions() {
    return CachingOptions.NO_CACHING;
  }

  /** Moves the evaluation time to {@code start}; {@code end} is ignored. */
  @Override
  public InstantQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().time(start).build();
  }

  @Override
  public InstantQueryRequest withQuery(String query) {
    return toBuilder().query(query).build();
  }

  @Override
  public InstantQueryRequest withShards(List<ShardSpec> shards) {
    return toBuilder()
        .clearShards()
        .shards(shards.stream().map(ShardSpec::encode).collect(Collectors.toList()))
        .build();
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.of(
        "query", query,
        "ts", time.toString(),
        "limit", String.valueOf(limit),
        "direction", direction.name(),
        "shards", String.join(",", shards));
  }
}
