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

/** Lookup of the series matching any of the {@code match[]} selectors. */
@Value
@Builder(toBuilder = true)
public class SeriesQueryRequest implements LogQueryRequest {
  @Singular("matchGroup") List<String> match;
  @NonNull Instant start;
  @NonNull Instant end;
  @Singular List<String> shards;
  @NonNull @Builder.Default String path = QueryRoute.SERIES.getPath();

  @Override
  public RequestKind getKind() {
    return RequestKind.SERIES;
  }

  @Override
  public String getQuery() {
    return "";
  }

  @Override
  public long getStep() {
    return 0;
  }

  @Override
  public CachingOptions getCachingOptions() {
    return CachingOptions.NO_CACHING;
  }

  @Override
  public SeriesQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().start(start).end(end).build();
  }

  /** Series requests carry matchers, not a query, so the copy is unchanged. */
  @Override
  public SeriesQueryRequest withQuery(String query) {
    return toBuilder().build();
  }

  @Override
  public SeriesQueryRequest withShards(List<ShardSpec> shards) {
    return toBuilder()
        .clearShards()
        .shards(shards.stream().map(ShardSpec::encode).collect(Collectors.toList()))
        .build();
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.of(
        "matchers", String.join(",", match),
        "start", start.toString(),
        "end", end.toString(),
        "shards", String.join(",", shards));
  }
}
