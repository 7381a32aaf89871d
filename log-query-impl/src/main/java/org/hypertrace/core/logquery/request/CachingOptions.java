package org.hypertrace.core.logquery.request;

import lombok.Value;

@Value
public class CachingOptions {
  /** Requests are not cached unless they explicitly allow it. */
  public static final CachingOptions NO_CACHING = new CachingOptions(true);

  public static final CachingOptions CACHEABLE = new CachingOptions(false);

  boolean disabled;
}
