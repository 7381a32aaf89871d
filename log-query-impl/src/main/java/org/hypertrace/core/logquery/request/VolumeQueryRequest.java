package org.hypertrace.core.logquery.request;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Volume of the streams matching {@code matchers}, aggregated by series or by label. A non-zero
 * step turns it into a volume range request.
 */
@Value
@Builder(toBuilder = true)
public class VolumeQueryRequest implements LogQueryRequest {
  public static final String AGGREGATE_BY_SERIES = "series";
  public static final String AGGREGATE_BY_LABELS = "labels";
  public static final int DEFAULT_LIMIT = 100;

  @NonNull Instant from;
  @NonNull Instant through;
  @NonNull String matchers;
  @Builder.Default int limit = DEFAULT_LIMIT;
  long step;
  @Singular List<String> targetLabels;
  @NonNull @Builder.Default String aggregateBy = AGGREGATE_BY_SERIES;

  @Override
  public RequestKind getKind() {
    return RequestKind.VOLUME;
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
  public List<String> getShards() {
    return List.of();
  }

  @Override
  public String getPath() {
    return isRange() ? QueryRoute.VOLUME_RANGE.getPath() : QueryRoute.VOLUME.getPath();
  }

  @Override
  public CachingOptions getCachingOptions() {
    return CachingOptions.NO_CACHING;
  }

  public boolean isRange() {
    return step != 0;
  }

  @Override
  public VolumeQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().from(start).through(end).build();
  }

  @Override
  public VolumeQueryRequest withQuery(String query) {
    return toBuilder().matchers(query).build();
  }

  @Override
  public VolumeQueryRequest withShards(List<ShardSpec> shards) {
    return this;
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.of(
        "matchers", matchers,
        "start", from.toString(),
        "end", through.toString(),
        "step (ms)", String.valueOf(step),
        "limit", String.valueOf(limit),
        "aggregateBy", aggregateBy);
  }
}
