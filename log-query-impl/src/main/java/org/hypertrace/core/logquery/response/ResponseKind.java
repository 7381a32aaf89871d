package org.hypertrace.core.logquery.response;

/** The closed set of response variants. Every switch over it handles all values. */
public enum ResponseKind {
  PROMETHEUS,
  STREAMS,
  SERIES,
  SERIES_VIEW,
  MERGED_SERIES_VIEW,
  LABEL_NAMES,
  INDEX_STATS,
  VOLUME,
  TOPK_SKETCHES,
  QUANTILE_SKETCHES
}
