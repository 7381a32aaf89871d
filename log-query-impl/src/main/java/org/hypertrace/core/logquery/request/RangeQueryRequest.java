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

@Value
@Builder(toBuilder = true)
public class RangeQueryRequest implements LogQueryRequest {
  @NonNull String query;
  @NonNull Instant start;
  @NonNull Instant end;
  long step;
  long interval;
  @NonNull @Builder.Default Direction direction = Direction.BACKWARD;
  int limit;
  @Singular List<String> shards;
  @NonNull @Builder.Default String path = QueryRoute.QUERY_RANGE.getPath();
  @NonNull @Builder.Default CachingOptions cachingOptions = CachingOptions.NO_CACHING;

  @Override
  public RequestKind getKind() {
    return RequestKind.RANGE;
  }

  @Override
  public RangeQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().start(start).end(end).build();
  }

  @Override
  public RangeQueryRequest withQuery(String query) {
    return toBuilder().query(query).build();
  }

  @Override
  public RangeQueryRequest withShards(List<ShardSpec> shards) {
    return toBuilder()
        .clearShards()
        .shards(shards.stream().map(ShardSpec::encode).collect(Collectors.toList()))
        .build();
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.<String, String>builder()
        .put("query", query)
        .put("start", start.toString())
        .put("end", end.toString())
        .put("step (ms)", String.valueOf(step))
        .put("interval (ms)", String.valueOf(interval))
        .put("limit", String.valueOf(limit))
        .put("direction", direction.name())
        .put("shards", String.join(",", shards))
        .build();
  }
}
