package org.hypertrace.core.logquery.params;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.logquery.request.Direction;

/** Uniform view over any request, consumed by planning and by the response decoders. */
public interface QueryParams {
  String getQuery();

  Instant getStart();

  Instant getEnd();

  Duration getStep();

  Duration getInterval();

  Direction getDirection();

  int getLimit();

  List<String> getShards();
}
