package org.hypertrace.core.logquery;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Per-request overrides of tenant limits. They travel between components as a JSON document in the
 * {@link LogQueryHeaders#QUERY_LIMITS} header.
 */
@Value
@Builder
public class QueryLimits {
  private static final Gson GSON = new Gson();

  String maxQueryLength;
  String maxQueryRange;
  String maxQueryLookback;
  int maxEntriesLimitPerQuery;
  String queryTimeout;
  @Singular List<String> requiredLabels;
  int requiredNumberLabels;
  String maxQueryBytesRead;

  public String toHeaderValue() {
    return GSON.toJson(this);
  }

  public static QueryLimits fromHeaderValue(String headerValue) throws JsonParseException {
    return GSON.fromJson(headerValue, QueryLimits.class);
  }
}
