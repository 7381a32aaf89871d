package org.hypertrace.core.logquery.codec;

import lombok.Value;
import org.hypertrace.core.logquery.QueryContext;
import org.hypertrace.core.logquery.request.LogQueryRequest;

/** A decoded request together with the context enriched from its headers. */
@Value
public class DecodedRequest {
  LogQueryRequest request;
  QueryContext context;
}
