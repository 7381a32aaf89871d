package org.hypertrace.core.logquery.response;

import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.logquery.labels.LabelSets;

/** Samples of one series, ascending by timestamp. */
@Value
public class SampleStream {
  @NonNull Map<String, String> labels;
  @NonNull List<Sample> samples;

  /** String form of the labels; series are grouped and ordered by it. */
  public String labelKey() {
    return LabelSets.format(labels);
  }
}
