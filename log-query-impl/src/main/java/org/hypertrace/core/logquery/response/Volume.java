package org.hypertrace.core.logquery.response;

import lombok.NonNull;
import lombok.Value;

/** Bytes ingested for one series or label, {@code name} being its label set string. */
@Value
public class Volume {
  @NonNull String name;
  long volume;
}
