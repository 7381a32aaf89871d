package org.hypertrace.core.logquery.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.logquery.api.Statistics;

/**
 * Counters describing the work done to answer a query. Every field is additive, so the statistics
 * of a merged answer are the field-wise sum of the statistics of its parts and {@link #EMPTY} is
 * the neutral element.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class QueryStatistics {
  public static final QueryStatistics EMPTY = QueryStatistics.builder().build();

  @JsonProperty("summary")
  @NonNull
  @Builder.Default
  Summary summary = Summary.builder().build();

  @JsonProperty("store")
  @NonNull
  @Builder.Default
  Store store = Store.builder().build();

  public QueryStatistics merge(QueryStatistics other) {
    return new QueryStatistics(summary.merge(other.summary), store.merge(other.store));
  }

  public Statistics toProto() {
    return Statistics.newBuilder()
        .setSummary(
            Statistics.Summary.newBuilder()
                .setBytesProcessed(summary.bytesProcessed)
                .setLinesProcessed(summary.linesProcessed)
                .setTotalEntriesReturned(summary.totalEntriesReturned)
                .setExecTime(summary.execTime)
                .setQueueTime(summary.queueTime)
                .setSplits(summary.splits)
                .setShards(summary.shards))
        .setStore(
            Statistics.Store.newBuilder()
                .setTotalChunksRef(store.totalChunksRef)
                .setTotalChunksDownloaded(store.totalChunksDownloaded)
                .setChunksDownloadTimeNanos(store.chunksDownloadTimeNanos)
                .setDecompressedBytes(store.decompressedBytes)
                .setDecompressedLines(store.decompressedLines))
        .build();
  }

  public static QueryStatistics fromProto(Statistics statistics) {
    Statistics.Summary summary = statistics.getSummary();
    Statistics.Store store = statistics.getStore();
    return new QueryStatistics(
        Summary.builder()
            .bytesProcessed(summary.getBytesProcessed())
            .linesProcessed(summary.getLinesProcessed())
            .totalEntriesReturned(summary.getTotalEntriesReturned())
            .execTime(summary.getExecTime())
            .queueTime(summary.getQueueTime())
            .splits(summary.getSplits())
            .shards(summary.getShards())
            .build(),
        Store.builder()
            .totalChunksRef(store.getTotalChunksRef())
            .totalChunksDownloaded(store.getTotalChunksDownloaded())
            .chunksDownloadTimeNanos(store.getChunksDownloadTimeNanos())
            .decompressedBytes(store.getDecompressedBytes())
            .decompressedLines(store.getDecompressedLines())
            .build());
  }

  @Value
  @Jacksonized
  @Builder
  public static class Summary {
    @JsonProperty("bytesProcessed")
    long bytesProcessed;

    @JsonProperty("linesProcessed")
    long linesProcessed;

    @JsonProperty("totalEntriesReturned")
    long totalEntriesReturned;

    /** Seconds. */
    @JsonProperty("execTime")
    double execTime;

    /** Seconds. */
    @JsonProperty("queueTime")
    double queueTime;

    @JsonProperty("splits")
    long splits;

    @JsonProperty("shards")
    long shards;

    Summary merge(Summary other) {
      return new Summary(
          bytesProcessed + other.bytesProcessed,
          linesProcessed + other.linesProcessed,
          totalEntriesReturned + other.totalEntriesReturned,
          execTime + other.execTime,
          queueTime + other.queueTime,
          splits + other.splits,
          shards + other.shards);
    }
  }

  @Value
  @Jacksonized
  @Builder
  public static class Store {
    @JsonProperty("totalChunksRef")
    long totalChunksRef;

    @JsonProperty("totalChunksDownloaded")
    long totalChunksDownloaded;

    @JsonProperty("chunksDownloadTime")
    long chunksDownloadTimeNanos;

    @JsonProperty("decompressedBytes")
    long decompressedBytes;

    @JsonProperty("decompressedLines")
    long decompressedLines;

    Store merge(Store other) {
      return new Store(
          totalChunksRef + other.totalChunksRef,
          totalChunksDownloaded + other.totalChunksDownloaded,
          chunksDownloadTimeNanos + other.chunksDownloadTimeNanos,
          decompressedBytes + other.decompressedBytes,
          decompressedLines + other.decompressedLines);
    }
  }
}
