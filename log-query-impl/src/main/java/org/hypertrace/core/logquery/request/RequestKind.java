package org.hypertrace.core.logquery.request;

/** The closed set of request variants. Every switch over it handles all values. */
public enum RequestKind {
  RANGE,
  INSTANT,
  SERIES,
  LABEL,
  INDEX_STATS,
  VOLUME
}
