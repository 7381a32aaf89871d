package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class QueryResponseHeader {
  @NonNull String name;
  @NonNull List<String> values;
}
