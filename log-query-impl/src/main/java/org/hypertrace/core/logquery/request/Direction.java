package org.hypertrace.core.logquery.request;

import java.util.Locale;

/** Order in which log entries are returned. */
public enum Direction {
  FORWARD,
  BACKWARD;

  /**
   * @throws IllegalArgumentException if the value names no direction
   */
  public static Direction parse(String value) {
    try {
      return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format("invalid direction '%s'", value), e);
    }
  }

  public org.hypertrace.core.logquery.api.Direction toProto() {
    return this == FORWARD
        ? org.hypertrace.core.logquery.api.Direction.FORWARD
        : org.hypertrace.core.logquery.api.Direction.BACKWARD;
  }

  public static Direction fromProto(org.hypertrace.core.logquery.api.Direction direction) {
    return direction == org.hypertrace.core.logquery.api.Direction.BACKWARD ? BACKWARD : FORWARD;
  }
}
