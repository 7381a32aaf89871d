package org.hypertrace.core.logquery.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hypertrace.core.logquery.response.PrometheusQueryResponse;
import org.hypertrace.core.logquery.response.Sample;
import org.hypertrace.core.logquery.response.SampleStream;

/**
 * Concatenates the series of metric answers. Series are matched by label set; samples at or before
 * the last timestamp already kept for a series are dropped so that overlapping time splits do not
 * repeat points.
 */
class PrometheusMerger {

  static PrometheusQueryResponse merge(List<PrometheusQueryResponse> responses) {
    Map<String, Map<String, String>> labelsByKey = new TreeMap<>();
    Map<String, List<Sample>> samplesByKey = new TreeMap<>();
    for (PrometheusQueryResponse response : responses) {
      for (SampleStream stream : response.getResult()) {
        String key = stream.labelKey();
        labelsByKey.putIfAbsent(key, stream.getLabels());
        List<Sample> kept = samplesByKey.computeIfAbsent(key, unused -> new ArrayList<>());
        long lastTimestamp =
            kept.isEmpty() ? Long.MIN_VALUE : kept.get(kept.size() - 1).getTimestampMs();
        for (Sample sample : stream.getSamples()) {
          if (kept.isEmpty() || sample.getTimestampMs() > lastTimestamp) {
            kept.add(sample);
            lastTimestamp = sample.getTimestampMs();
          }
        }
      }
    }

    List<SampleStream> result = new ArrayList<>(samplesByKey.size());
    for (Map.Entry<String, List<Sample>> series : samplesByKey.entrySet()) {
      result.add(
          new SampleStream(labelsByKey.get(series.getKey()), List.copyOf(series.getValue())));
    }
    return responses.get(0).toBuilder()
        .clearResult()
        .result(result)
        .statistics(ResponseMerger.sumStatistics(responses))
        .build();
  }
}
