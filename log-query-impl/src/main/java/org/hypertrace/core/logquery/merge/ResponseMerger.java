package org.hypertrace.core.logquery.merge;

import com.google.common.base.Preconditions;
import io.grpc.StatusException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.response.IndexStatsQueryResponse;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.MergedSeriesQueryResponseView;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.QueryStatistics;
import org.hypertrace.core.logquery.response.ResponseKind;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;
import org.hypertrace.core.logquery.response.SeriesQueryResponseView;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;

/**
 * Combines the partial answers of several shards into one. Inputs are never modified. Status,
 * version, direction, limit and headers of the merged answer are those of the first input, and
 * statistics are summed.
 */
@Slf4j
public class ResponseMerger {

  /**
   * @throws IllegalArgumentException if {@code responses} is empty or mixes response kinds
   * @throws StatusException UNIMPLEMENTED for sketch answers, which cannot be merged here
   */
  public LogQueryResponse merge(List<? extends LogQueryResponse> responses)
      throws StatusException {
    Preconditions.checkArgument(
        !responses.isEmpty(), "merging responses requires at least one response");
    ResponseKind kind = responses.get(0).getKind();
    for (LogQueryResponse response : responses) {
      Preconditions.checkArgument(
          compatible(kind, response.getKind()),
          "cannot merge %s response with %s response",
          response.getKind(),
          kind);
    }
    log.debug("Merging {} {} responses", responses.size(), kind);

    switch (kind) {
      case PROMETHEUS:
        return PrometheusMerger.merge(cast(responses, PrometheusQueryResponse.class));
      case STREAMS:
        return StreamsMerger.merge(cast(responses, StreamsQueryResponse.class));
      case SERIES:
        return SeriesMerger.merge(cast(responses, SeriesQueryResponse.class));
      case SERIES_VIEW:
      case MERGED_SERIES_VIEW:
        return mergeSeriesViews(responses);
      case LABEL_NAMES:
        return mergeLabelNames(cast(responses, LabelNamesQueryResponse.class));
      case INDEX_STATS:
        return mergeIndexStats(cast(responses, IndexStatsQueryResponse.class));
      case VOLUME:
        return VolumeMerger.merge(cast(responses, VolumeQueryResponse.class));
      case TOPK_SKETCHES:
      case QUANTILE_SKETCHES:
      default:
        throw LogQueryErrors.unsupportedKind("cannot merge " + kind + " responses");
    }
  }

  private static boolean compatible(ResponseKind first, ResponseKind other) {
    return first == other || (isSeriesView(first) && isSeriesView(other));
  }

  private static boolean isSeriesView(ResponseKind kind) {
    return kind == ResponseKind.SERIES_VIEW || kind == ResponseKind.MERGED_SERIES_VIEW;
  }

  private static MergedSeriesQueryResponseView mergeSeriesViews(
      List<? extends LogQueryResponse> responses) {
    List<SeriesQueryResponseView> views = new ArrayList<>();
    for (LogQueryResponse response : responses) {
      if (response.getKind() == ResponseKind.SERIES_VIEW) {
        views.add((SeriesQueryResponseView) response);
      } else {
        views.addAll(((MergedSeriesQueryResponseView) response).getResponses());
      }
    }
    return new MergedSeriesQueryResponseView(views, responses.get(0).getHeaders());
  }

  private static LabelNamesQueryResponse mergeLabelNames(
      List<LabelNamesQueryResponse> responses) {
    Set<String> names = new LinkedHashSet<>();
    for (LabelNamesQueryResponse response : responses) {
      names.addAll(response.getData());
    }
    return responses.get(0).toBuilder()
        .clearData()
        .data(names)
        .statistics(sumStatistics(responses))
        .build();
  }

  private static IndexStatsQueryResponse mergeIndexStats(List<IndexStatsQueryResponse> responses) {
    IndexStatsQueryResponse merged = responses.get(0);
    for (IndexStatsQueryResponse response : responses.subList(1, responses.size())) {
      merged = merged.add(response);
    }
    return merged;
  }

  static QueryStatistics sumStatistics(List<? extends LogQueryResponse> responses) {
    QueryStatistics statistics = QueryStatistics.EMPTY;
    for (LogQueryResponse response : responses) {
      statistics = statistics.merge(response.getStatistics());
    }
    return statistics;
  }

  private static <T extends LogQueryResponse> List<T> cast(
      List<? extends LogQueryResponse> responses, Class<T> type) {
    return responses.stream().map(type::cast).collect(Collectors.toList());
  }
}
