package org.hypertrace.core.logquery.response;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.logquery.ApiVersion;

/**
 * Union of several series views. Nothing is decoded when merging; duplicates are dropped while the
 * union is iterated, which happens once when it is encoded for the client.
 */
public class MergedSeriesQueryResponseView implements LogQueryResponse {
  private final List<SeriesQueryResponseView> responses;
  private final List<QueryResponseHeader> headers;

  public MergedSeriesQueryResponseView(
      List<SeriesQueryResponseView> responses, List<QueryResponseHeader> headers) {
    Preconditions.checkArgument(!responses.isEmpty(), "no series views to merge");
    this.responses = List.copyOf(responses);
    this.headers = List.copyOf(headers);
  }

  public List<SeriesQueryResponseView> getResponses() {
    return responses;
  }

  @Override
  public ResponseKind getKind() {
    return ResponseKind.MERGED_SERIES_VIEW;
  }

  @Override
  public String getStatus() {
    return responses.get(0).getStatus();
  }

  public int getVersion() {
    return responses.get(0).getVersion();
  }

  @Override
  public List<QueryResponseHeader> getHeaders() {
    return headers;
  }

  @Override
  public QueryStatistics getStatistics() {
    QueryStatistics statistics = QueryStatistics.EMPTY;
    for (SeriesQueryResponseView response : responses) {
      statistics = statistics.merge(response.getStatistics());
    }
    return statistics;
  }

  @Override
  public MergedSeriesQueryResponseView withHeaders(List<QueryResponseHeader> headers) {
    return new MergedSeriesQueryResponseView(responses, headers);
  }

  /**
   * Series of all views in order, keeping the first occurrence of each label set. Every iteration
   * deduplicates afresh.
   */
  public Iterable<SeriesQueryResponseView.SeriesIdentifierView> uniqueSeries() {
    return () -> {
      Set<Long> seen = new HashSet<>();
      return Iterators.filter(
          Iterables.concat(responses).iterator(), identifier -> seen.add(identifier.hash()));
    };
  }

  public SeriesQueryResponse materialize() {
    SeriesQueryResponse.SeriesQueryResponseBuilder builder =
        SeriesQueryResponse.builder()
            .status(getStatus())
            .version(ApiVersion.fromValue(getVersion()))
            .headers(headers)
            .statistics(getStatistics());
    for (SeriesQueryResponseView.SeriesIdentifierView identifier : uniqueSeries()) {
      builder.series(identifier.materialize());
    }
    return builder.build();
  }
}
