package org.hypertrace.core.logquery.request;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Lookup of label names or, when {@link #isValues()} is set, of the values of label {@link
 * #getName()}. The original path is kept because both lookups are forwarded on the route they came
 * in on.
 */
@Value
@Builder(toBuilder = true)
public class LabelQueryRequest implements LogQueryRequest {
  @NonNull Instant start;
  @NonNull Instant end;
  @NonNull @Builder.Default String query = "";
  @NonNull @Builder.Default String name = "";
  boolean values;
  @NonNull @Builder.Default String path = QueryRoute.LABEL_NAMES.getPath();

  public static LabelQueryRequest of(
      Instant start, Instant end, String query, String name, String path) {
    return LabelQueryRequest.builder()
        .start(start)
        .end(end)
        .query(query)
        .name(name)
        .values(!name.isEmpty())
        .path(path)
        .build();
  }

  @Override
  public RequestKind getKind() {
    return RequestKind.LABEL;
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
  public CachingOptions getCachingOptions() {
    return CachingOptions.NO_CACHING;
  }

  @Override
  public LabelQueryRequest withStartEnd(Instant start, Instant end) {
    return toBuilder().start(start).end(end).build();
  }

  @Override
  public LabelQueryRequest withQuery(String query) {
    return toBuilder().query(query).build();
  }

  /** Label lookups are not sharded. */
  @Override
  public LabelQueryRequest withShards(List<ShardSpec> shards) {
    return this;
  }

  @Override
  public Map<String, String> describe() {
    return ImmutableMap.of(
        "start", start.toString(),
        "end", end.toString(),
        "name", name);
  }
}
