package org.hypertrace.core.logquery.cache;

import com.google.common.base.Preconditions;
import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import io.grpc.StatusException;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.api.CachedResponse;
import org.hypertrace.core.logquery.api.Extent;
import org.hypertrace.core.logquery.api.QueryResponse;
import org.hypertrace.core.logquery.codec.ProtobufResponseConverter;
import org.hypertrace.core.logquery.response.LogQueryResponse;

/**
 * Persisted form of answers kept by a results cache. An extent holds the answer for one time range,
 * packed as the binary response envelope; a cached response holds the extents of one cache key.
 * Extent bounds are epoch milliseconds.
 */
public class CachedResponses {

  private CachedResponses() {}

  public static Extent toExtent(
      Instant start, Instant end, String traceId, LogQueryResponse response)
      throws StatusException {
    Preconditions.checkArgument(!end.isBefore(start), "extent ends before it starts");
    return Extent.newBuilder()
        .setStart(start.toEpochMilli())
        .setEnd(end.toEpochMilli())
        .setTraceId(traceId == null ? "" : traceId)
        .setResponse(Any.pack(ProtobufResponseConverter.wrap(response)))
        .build();
  }

  /** @throws StatusException INTERNAL if the extent does not hold a response envelope */
  public static LogQueryResponse fromExtent(Extent extent) throws StatusException {
    if (!extent.hasResponse() || !extent.getResponse().is(QueryResponse.class)) {
      throw LogQueryErrors.internal("extent does not hold a query response");
    }
    try {
      return ProtobufResponseConverter.unwrap(
          extent.getResponse().unpack(QueryResponse.class), List.of());
    } catch (InvalidProtocolBufferException e) {
      throw LogQueryErrors.internal("error decoding cached extent: " + e.getMessage(), e);
    }
  }

  /**
   * @throws IllegalArgumentException if the extents are not ordered by start or overlap
   */
  public static CachedResponse toCachedResponse(String key, List<Extent> extents) {
    Preconditions.checkArgument(key != null && !key.isEmpty(), "cache key must not be empty");
    Extent previous = null;
    for (Extent extent : extents) {
      Preconditions.checkArgument(
          extent.getStart() <= extent.getEnd(),
          "extent [%s, %s] ends before it starts",
          extent.getStart(),
          extent.getEnd());
      if (previous != null) {
        Preconditions.checkArgument(
            extent.getStart() >= previous.getEnd(),
            "extent starting at %s overlaps or precedes extent ending at %s",
            extent.getStart(),
            previous.getEnd());
      }
      previous = extent;
    }
    return CachedResponse.newBuilder().setKey(key).addAllExtents(extents).build();
  }
}
