package org.hypertrace.core.logquery.params;

import io.grpc.StatusException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.request.Direction;
import org.hypertrace.core.logquery.request.IndexStatsQueryRequest;
import org.hypertrace.core.logquery.request.InstantQueryRequest;
import org.hypertrace.core.logquery.request.LabelQueryRequest;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.request.RangeQueryRequest;
import org.hypertrace.core.logquery.request.SeriesQueryRequest;
import org.hypertrace.core.logquery.request.VolumeQueryRequest;

/**
 * Adapts every request variant to {@link QueryParams}. Steps and intervals are stored in
 * milliseconds and exposed as durations. Variants without a direction or a limit report {@link
 * Direction#FORWARD} and zero.
 */
public class QueryParamsAdapter {

  public static QueryParams adapt(LogQueryRequest request) throws StatusException {
    switch (request.getKind()) {
      case RANGE:
        return new RangeParams((RangeQueryRequest) request);
      case VOLUME:
        return new RangeParams(asRangeQuery((VolumeQueryRequest) request));
      case INSTANT:
        return new InstantParams((InstantQueryRequest) request);
      case SERIES:
        return new SeriesParams((SeriesQueryRequest) request);
      case LABEL:
        return new LabelParams((LabelQueryRequest) request);
      case INDEX_STATS:
        return new IndexStatsParams((IndexStatsQueryRequest) request);
      default:
        throw LogQueryErrors.unsupportedKind(
            "no query params for request kind " + request.getKind());
    }
  }

  private static RangeQueryRequest asRangeQuery(VolumeQueryRequest request) {
    return RangeQueryRequest.builder()
        .query(request.getMatchers())
        .direction(Direction.FORWARD)
        .limit(request.getLimit())
        .step(request.getStep())
        .start(request.getFrom())
        .end(request.getThrough())
        .build();
  }

  private static Duration millis(long millis) {
    return Duration.ofNanos(millis * 1_000_000L);
  }

  @AllArgsConstructor
  private static class RangeParams implements QueryParams {
    private final RangeQueryRequest request;

    @Override
    public String getQuery() {
      return request.getQuery();
    }

    @Override
    public Instant getStart() {
      return request.getStart();
    }

    @Override
    public Instant getEnd() {
      return request.getEnd();
    }

    @Override
    public Duration getStep() {
      return millis(request.getStep());
    }

    @Override
    public Duration getInterval() {
      return millis(request.getInterval());
    }

    @Override
    public Direction getDirection() {
      return request.getDirection();
    }

    @Override
    public int getLimit() {
      return request.getLimit();
    }

    @Override
    public List<String> getShards() {
      return request.getShards();
    }
  }

  @AllArgsConstructor
  private static class InstantParams implements QueryParams {
    private final InstantQueryRequest request;

    @Override
    public String getQuery() {
      return request.getQuery();
    }

    @Override
    public Instant getStart() {
      return request.getTime();
    }

    @Override
    public Instant getEnd() {
      return request.getTime();
    }

    @Override
    public Duration getStep() {
      return millis(request.getStep());
    }

    @Override
    public Duration getInterval() {
      return Duration.ZERO;
    }

    @Override
    public Direction getDirection() {
      return request.getDirection();
    }

    @Override
    public int getLimit() {
      return request.getLimit();
    }

    @Override
    public List<String> getShards() {
      return request.getShards();
    }
  }

  /** Base of the variants that have neither a direction nor a limit. */
  @AllArgsConstructor
  private abstract static class UnorderedParams implements QueryParams {
    private final LogQueryRequest request;

    @Override
    public String getQuery() {
      return request.getQuery();
    }

    @Override
    public Instant getStart() {
      return request.getStart();
    }

    @Override
    public Instant getEnd() {
      return request.getEnd();
    }

    @Override
    public Duration getStep() {
      return millis(request.getStep());
    }

    @Override
    public Duration getInterval() {
      return Duration.ZERO;
    }

    @Override
    public Direction getDirection() {
      return Direction.FORWARD;
    }

    @Override
    public int getLimit() {
      return 0;
    }
  }

  private static class SeriesParams extends UnorderedParams {
    private final SeriesQueryRequest request;

    SeriesParams(SeriesQueryRequest request) {
      super(request);
      this.request = request;
    }

    @Override
    public List<String> getShards() {
      return request.getShards();
    }
  }

  private static class LabelParams extends UnorderedParams {
    LabelParams(LabelQueryRequest request) {
      super(request);
    }

    @Override
    public List<String> getShards() {
      return List.of();
    }
  }

  private static class IndexStatsParams extends UnorderedParams {
    IndexStatsParams(IndexStatsQueryRequest request) {
      super(request);
    }

    @Override
    public List<String> getShards() {
      return List.of();
    }
  }
}
