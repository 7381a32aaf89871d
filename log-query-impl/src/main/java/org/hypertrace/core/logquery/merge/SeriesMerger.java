package org.hypertrace.core.logquery.merge;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.logquery.response.SeriesIdentifier;
import org.hypertrace.core.logquery.response.SeriesQueryResponse;

/**
 * Union of series answers. Series are identified by the hash of their label set, so two distinct
 * label sets with colliding hashes are reported once.
 */
class SeriesMerger {

  static SeriesQueryResponse merge(List<SeriesQueryResponse> responses) {
    Set<Long> seen = new HashSet<>();
    SeriesQueryResponse.SeriesQueryResponseBuilder builder =
        responses.get(0).toBuilder()
            .clearData()
            .statistics(ResponseMerger.sumStatistics(responses));
    for (SeriesQueryResponse response : responses) {
      for (SeriesIdentifier series : response.getData()) {
        if (seen.add(series.hash())) {
          builder.series(series);
        }
      }
    }
    return builder.build();
  }
}
