package org.hypertrace.core.logquery.request;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** HTTP routes served by the codec, matched on the URL path. */
public enum QueryRoute {
  QUERY_RANGE("/loki/api/v1/query_range"),
  INSTANT_QUERY("/loki/api/v1/query"),
  SERIES("/loki/api/v1/series"),
  LABEL_NAMES("/loki/api/v1/labels"),
  INDEX_STATS("/loki/api/v1/index/stats"),
  VOLUME("/loki/api/v1/index/volume"),
  VOLUME_RANGE("/loki/api/v1/index/volume_range");

  private static final Pattern LABEL_VALUES_PATH =
      Pattern.compile("/loki/api/v1/label/(?<name>[^/]+)/values");

  private final String path;

  QueryRoute(String path) {
    this.path = path;
  }

  /** Canonical path used when encoding a request for a shard. */
  public String getPath() {
    return path;
  }

  public static Optional<QueryRoute> fromPath(String path) {
    if (path.endsWith("/query_range") || path.endsWith("/prom/query")) {
      return Optional.of(QUERY_RANGE);
    }
    if (path.endsWith("/series")) {
      return Optional.of(SERIES);
    }
    if (path.endsWith("/labels") || path.endsWith("/label") || path.endsWith("/values")) {
      return Optional.of(LABEL_NAMES);
    }
    if (path.endsWith("/v1/query")) {
      return Optional.of(INSTANT_QUERY);
    }
    if (path.equals(INDEX_STATS.path)) {
      return Optional.of(INDEX_STATS);
    }
    if (path.equals(VOLUME.path)) {
      return Optional.of(VOLUME);
    }
    if (path.equals(VOLUME_RANGE.path)) {
      return Optional.of(VOLUME_RANGE);
    }
    return Optional.empty();
  }

  /** Extracts {@code name} out of {@code /loki/api/v1/label/<name>/values}. */
  public static Optional<String> labelNameFromPath(String path) {
    Matcher matcher = LABEL_VALUES_PATH.matcher(path);
    return matcher.find() ? Optional.of(matcher.group("name")) : Optional.empty();
  }
}
