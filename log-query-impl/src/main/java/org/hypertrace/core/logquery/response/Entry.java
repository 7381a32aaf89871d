package org.hypertrace.core.logquery.response;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** A single log line. Metadata maps keep the order in which pairs were received. */
@Value
@Builder(toBuilder = true)
public class Entry {
  @NonNull Instant timestamp;
  @NonNull String line;
  @NonNull @Builder.Default Map<String, String> structuredMetadata = Map.of();
  @NonNull @Builder.Default Map<String, String> parsed = Map.of();

  public static Entry of(Instant timestamp, String line) {
    return Entry.builder().timestamp(timestamp).line(line).build();
  }
}
