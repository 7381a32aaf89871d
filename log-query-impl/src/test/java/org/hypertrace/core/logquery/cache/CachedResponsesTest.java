package org.hypertrace.core.logquery.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.protobuf.Any;
import io.grpc.Status;
import io.grpc.StatusException;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.logquery.api.CachedResponse;
import org.hypertrace.core.logquery.api.Extent;
import org.hypertrace.core.logquery.api.LabelPair;
import org.hypertrace.core.logquery.response.LabelNamesQueryResponse;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;
import org.junit.jupiter.api.Test;

class CachedResponsesTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void extentsKeepTheirAnswer() throws StatusException {
    LabelNamesQueryResponse labels =
        LabelNamesQueryResponse.builder().name("app").name("env").build();

    Extent extent = CachedResponses.toExtent(START, START.plusSeconds(60), "trace-1", labels);
    LogQueryResponse restored = CachedResponses.fromExtent(extent);

    assertEquals(START.toEpochMilli(), extent.getStart());
    assertEquals(START.plusSeconds(60).toEpochMilli(), extent.getEnd());
    assertEquals("trace-1", extent.getTraceId());
    assertEquals(labels, restored);
  }

  @Test
  void rejectsExtentsWithoutAnswer() {
    Extent empty = Extent.newBuilder().setStart(1).setEnd(2).build();
    Extent foreign =
        Extent.newBuilder().setResponse(Any.pack(LabelPair.newBuilder().build())).build();

    assertEquals(
        Status.Code.INTERNAL,
        assertThrows(StatusException.class, () -> CachedResponses.fromExtent(empty))
            .getStatus()
            .getCode());
    assertEquals(
        Status.Code.INTERNAL,
        assertThrows(StatusException.class, () -> CachedResponses.fromExtent(foreign))
            .getStatus()
            .getCode());
  }

  @Test
  void groupsOrderedExtentsUnderOneKey() throws StatusException {
    Extent first = extent(0, 60);
    Extent second = extent(60, 120);

    CachedResponse cached =
        CachedResponses.toCachedResponse("tenant-1:{app=\"foo\"}", List.of(first, second));

    assertEquals("tenant-1:{app=\"foo\"}", cached.getKey());
    assertEquals(List.of(first, second), cached.getExtentsList());
  }

  @Test
  void rejectsMisorderedExtents() throws StatusException {
    Extent first = extent(0, 60);
    Extent overlapping = extent(30, 90);

    assertThrows(
        IllegalArgumentException.class,
        () -> CachedResponses.toCachedResponse("key", List.of(first, overlapping)));
    assertThrows(
        IllegalArgumentException.class,
        () -> CachedResponses.toCachedResponse("", List.of(first)));
    assertThrows(
        IllegalArgumentException.class,
        () -> CachedResponses.toExtent(START, START.minusSeconds(1), "", volume()));
  }

  private static Extent extent(long fromSecond, long toSecond) throws StatusException {
    return CachedResponses.toExtent(
        START.plusSeconds(fromSecond), START.plusSeconds(toSecond), null, volume());
  }

  private static VolumeQueryResponse volume() {
    return VolumeQueryResponse.builder().limit(10).build();
  }
}
