package org.hypertrace.core.logquery.response;

import java.util.Map;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.logquery.labels.LabelSetHasher;

@Value(staticConstructor = "of")
public class SeriesIdentifier {
  @NonNull Map<String, String> labels;

  public long hash() {
    return LabelSetHasher.hash(labels);
  }
}
