package org.hypertrace.core.logquery.codec;

import io.grpc.StatusException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.request.Direction;
import org.hypertrace.core.logquery.request.IndexStatsQueryRequest;
import org.hypertrace.core.logquery.request.InstantQueryRequest;
import org.hypertrace.core.logquery.request.LabelQueryRequest;
import org.hypertrace.core.logquery.request.QueryRoute;
import org.hypertrace.core.logquery.request.RangeQueryRequest;
import org.hypertrace.core.logquery.request.SeriesQueryRequest;
import org.hypertrace.core.logquery.request.ShardSpec;
import org.hypertrace.core.logquery.request.VolumeQueryRequest;

/**
 * Turns the query string of each route into a request variant. Every malformed parameter is
 * reported as INVALID_ARGUMENT with a message meant for the client.
 */
public class HttpQueryParser {
  private static final long MAX_POINTS_PER_SERIES = 11_000;
  private static final long STEP_RESOLUTION = 250;
  private static final int MAX_SECONDS_TIMESTAMP_LENGTH = 10;

  private final int defaultLimit;
  private final Duration defaultLookback;
  private final Clock clock;

  public HttpQueryParser(int defaultLimit, Duration defaultLookback, Clock clock) {
    this.defaultLimit = defaultLimit;
    this.defaultLookback = defaultLookback;
    this.clock = clock;
  }

  public RangeQueryRequest parseRangeQuery(QueryParameters params, String path)
      throws StatusException {
    String query = requiredQuery(params);
    Bounds bounds = bounds(params);
    Instant start = bounds.getStart();
    Instant end = bounds.getEnd();
    int limit = limit(params, defaultLimit);
    Direction direction = direction(params);
    Duration step = step(params, start, end);
    Duration interval = optionalDuration(params, "interval").orElse(Duration.ZERO);
    if (interval.isNegative()) {
      throw LogQueryErrors.badRequest("interval must be >= 0");
    }
    return RangeQueryRequest.builder()
        .query(query)
        .start(start)
        .end(end)
        .limit(limit)
        .direction(direction)
        .step(step.toMillis())
        .interval(interval.toMillis())
        .shards(shards(params))
        .path(path)
        .build();
  }

  public InstantQueryRequest parseInstantQuery(QueryParameters params, String path)
      throws StatusException {
    return InstantQueryRequest.builder()
        .query(requiredQuery(params))
        .time(timestamp(params, "time", clock.instant()))
        .limit(limit(params, defaultLimit))
        .direction(direction(params))
        .shards(shards(params))
        .path(path)
        .build();
  }

  public SeriesQueryRequest parseSeriesQuery(QueryParameters params, String path)
      throws StatusException {
    Bounds bounds = bounds(params);
    Set<String> groups = new LinkedHashSet<>(params.getAll("match[]"));
    groups.addAll(params.getAll("match"));
    groups.remove("");
    return SeriesQueryRequest.builder()
        .match(groups)
        .start(bounds.getStart())
        .end(bounds.getEnd())
        .shards(shards(params))
        .path(path)
        .build();
  }

  public LabelQueryRequest parseLabelQuery(QueryParameters params, String path)
      throws StatusException {
    Bounds bounds = bounds(params);
    String name = QueryRoute.labelNameFromPath(path).orElse("");
    return LabelQueryRequest.of(
        bounds.getStart(), bounds.getEnd(), params.get("query").orElse(""), name, path);
  }

  public IndexStatsQueryRequest parseIndexStatsQuery(QueryParameters params)
      throws StatusException {
    String query = requiredQuery(params);
    Bounds bounds = bounds(params);
    return IndexStatsQueryRequest.builder()
        .matchers(query)
        .from(floorToMillis(bounds.getStart()))
        .through(ceilToMillis(bounds.getEnd()))
        .build();
  }

  public VolumeQueryRequest parseVolumeQuery(QueryParameters params, boolean range)
      throws StatusException {
    String query = requiredQuery(params);
    Bounds bounds = bounds(params);
    String aggregateBy = params.get("aggregateBy").orElse(VolumeQueryRequest.AGGREGATE_BY_SERIES);
    if (!aggregateBy.equals(VolumeQueryRequest.AGGREGATE_BY_SERIES)
        && !aggregateBy.equals(VolumeQueryRequest.AGGREGATE_BY_LABELS)) {
      throw LogQueryErrors.badRequest("invalid aggregation option");
    }
    List<String> targetLabels =
        params.get("targetLabels").map(HttpQueryParser::splitLabels).orElse(List.of());
    return VolumeQueryRequest.builder()
        .matchers(query)
        .from(floorToMillis(bounds.getStart()))
        .through(ceilToMillis(bounds.getEnd()))
        .limit(limit(params, VolumeQueryRequest.DEFAULT_LIMIT))
        .step(range ? step(params, bounds.getStart(), bounds.getEnd()).toMillis() : 0)
        .targetLabels(targetLabels)
        .aggregateBy(aggregateBy)
        .build();
  }

  private String requiredQuery(QueryParameters params) throws StatusException {
    return params
        .get("query")
        .orElseThrow(() -> LogQueryErrors.badRequest("query parameter is required"));
  }

  private Bounds bounds(QueryParameters params) throws StatusException {
    Instant end = timestamp(params, "end", clock.instant());
    Duration since = optionalDuration(params, "since").orElse(defaultLookback);
    Instant start = timestamp(params, "start", lookbackStart(end, since));
    if (end.isBefore(start)) {
      throw LogQueryErrors.badRequest("end timestamp must not be before or equal to start time");
    }
    return new Bounds(start, end);
  }

  private Duration step(QueryParameters params, Instant start, Instant end)
      throws StatusException {
    Duration range = Duration.between(start, end);
    Duration step =
        optionalDuration(params, "step")
            .orElseGet(
                () -> Duration.ofSeconds(Math.max(range.getSeconds() / STEP_RESOLUTION, 1)));
    if (step.isZero() || step.isNegative()) {
      throw LogQueryErrors.badRequest(
          "zero or negative query resolution step widths are not accepted. "
              + "Try a positive integer");
    }
    if (points(range, step) > MAX_POINTS_PER_SERIES) {
      throw LogQueryErrors.badRequest(
          "exceeded maximum resolution of 11,000 points per timeseries. "
              + "Try increasing the value of the step parameter");
    }
    return step;
  }

  private static Instant lookbackStart(Instant end, Duration since) throws StatusException {
    try {
      return end.minus(since);
    } catch (DateTimeException | ArithmeticException e) {
      throw LogQueryErrors.badRequest(
          String.format("cannot look back %s from %s", since, end));
    }
  }

  /** Number of steps in the range, saturating at {@link Long#MAX_VALUE}. */
  private static long points(Duration range, Duration step) {
    try {
      return range.dividedBy(step);
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static List<String> shards(QueryParameters params) throws StatusException {
    List<String> shards = params.getAll("shards");
    for (String shard : shards) {
      try {
        ShardSpec.parse(shard);
      } catch (IllegalArgumentException e) {
        throw LogQueryErrors.badRequest(e.getMessage());
      }
    }
    return shards;
  }

  private Optional<Duration> optionalDuration(QueryParameters params, String name)
      throws StatusException {
    Optional<String> value = params.get(name);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(DurationStrings.parseSecondsOrDuration(value.get()));
    } catch (IllegalArgumentException e) {
      throw LogQueryErrors.badRequest(e.getMessage());
    }
  }

  private static int limit(QueryParameters params, int defaultLimit) throws StatusException {
    Optional<String> value = params.get("limit");
    if (value.isEmpty()) {
      return defaultLimit;
    }
    int limit;
    try {
      limit = Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw LogQueryErrors.badRequest(
          String.format("cannot parse \"%s\" to a valid limit", value.get()));
    }
    if (limit <= 0) {
      throw LogQueryErrors.badRequest("limit must be a positive value");
    }
    return limit;
  }

  private static Direction direction(QueryParameters params) throws StatusException {
    Optional<String> value = params.get("direction");
    if (value.isEmpty()) {
      return Direction.BACKWARD;
    }
    try {
      return Direction.parse(value.get());
    } catch (IllegalArgumentException e) {
      throw LogQueryErrors.badRequest(e.getMessage());
    }
  }

  /**
   * Accepts floating point seconds, integer seconds (up to ten digits), integer nanoseconds and
   * RFC3339 timestamps.
   */
  static Instant timestamp(QueryParameters params, String name, Instant defaultValue)
      throws StatusException {
    Optional<String> value = params.get(name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    String text = value.get();
    try {
      Optional<BigDecimal> seconds = text.contains(".") ? decimal(text) : Optional.empty();
      if (seconds.isPresent()) {
        return Instant.ofEpochSecond(
            0, seconds.get().setScale(3, RoundingMode.HALF_UP).movePointRight(9).longValueExact());
      }
      try {
        long number = Long.parseLong(text);
        return text.length() <= MAX_SECONDS_TIMESTAMP_LENGTH
            ? Instant.ofEpochSecond(number)
            : Instant.ofEpochSecond(0, number);
      } catch (NumberFormatException e) {
        return OffsetDateTime.parse(text).toInstant();
      }
    } catch (DateTimeParseException | ArithmeticException e) {
      throw LogQueryErrors.badRequest(
          String.format("cannot parse \"%s\" to a valid timestamp", text));
    }
  }

  private static Optional<BigDecimal> decimal(String text) {
    try {
      return Optional.of(new BigDecimal(text));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static List<String> splitLabels(String value) {
    return Arrays.stream(StringUtils.split(value, ','))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .collect(Collectors.toCollection(ArrayList::new));
  }

  private static Instant floorToMillis(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }

  private static Instant ceilToMillis(Instant instant) {
    Instant floor = instant.truncatedTo(ChronoUnit.MILLIS);
    return floor.equals(instant) ? floor : floor.plusMillis(1);
  }

  @Value
  private static class Bounds {
    Instant start;
    Instant end;
  }
}
