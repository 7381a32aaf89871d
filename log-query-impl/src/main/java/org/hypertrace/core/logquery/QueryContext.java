package org.hypertrace.core.logquery;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Request scoped values that travel alongside a request rather than inside it: tenant, query tags,
 * response encoding flags, actor path, query limits and the time the request spent queued. Only the
 * codecs read or write them. A context belongs to a single request.
 */
@Value
@Builder(toBuilder = true)
public class QueryContext {
  public static final QueryContext EMPTY = QueryContext.builder().build();

  String tenantId;
  String queryTags;
  @Singular Set<String> encodingFlags;
  String actorPath;
  QueryLimits queryLimits;
  Duration queueTime;

  public Optional<String> getTenantId() {
    return Optional.ofNullable(tenantId).filter(id -> !id.isEmpty());
  }

  public Optional<String> getQueryTags() {
    return Optional.ofNullable(queryTags).filter(tags -> !tags.isEmpty());
  }

  public Optional<String> getActorPath() {
    return Optional.ofNullable(actorPath).filter(path -> !path.isEmpty());
  }

  public Optional<QueryLimits> getQueryLimits() {
    return Optional.ofNullable(queryLimits);
  }

  public Optional<Duration> getQueueTime() {
    return Optional.ofNullable(queueTime);
  }

  public boolean hasEncodingFlag(String flag) {
    return encodingFlags.contains(flag);
  }

  public static QueryContext forTenant(String tenantId) {
    return QueryContext.builder().tenantId(tenantId).build();
  }
}
