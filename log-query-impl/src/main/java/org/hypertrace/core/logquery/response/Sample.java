package org.hypertrace.core.logquery.response;

import lombok.Value;

@Value
public class Sample {
  long timestampMs;
  double value;
}
