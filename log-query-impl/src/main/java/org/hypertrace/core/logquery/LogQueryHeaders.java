package org.hypertrace.core.logquery;

/** Header names and media types exchanged with clients and shards. */
public class LogQueryHeaders {
  public static final String ORG_ID = "X-Scope-OrgID";
  public static final String QUERY_TAGS = "X-Query-Tags";
  public static final String ENCODING_FLAGS = "X-Loki-Response-Encoding-Flags";
  public static final String ACTOR_PATH = "X-Loki-Actor-Path";
  public static final String QUERY_LIMITS = "X-Loki-Query-Limits";
  public static final String QUEUE_TIME = "X-Query-Queue-Time";

  public static final String ACCEPT = "Accept";
  public static final String CONTENT_TYPE = "Content-Type";

  public static final String JSON_TYPE = "application/json; charset=UTF-8";
  public static final String PROTOBUF_TYPE = "application/vnd.google.protobuf";

  /** Encoding flag asking for structured metadata and parsed labels to be reported apart. */
  public static final String FLAG_CATEGORIZE_LABELS = "categorize-labels";
}
