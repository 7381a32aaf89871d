package org.hypertrace.core.logquery.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import org.hypertrace.core.logquery.request.Direction;
import org.hypertrace.core.logquery.response.Entry;
import org.hypertrace.core.logquery.response.LogStream;
import org.hypertrace.core.logquery.response.StreamsQueryResponse;

/**
 * Merges log answers whose entries are ordered in the query direction. The merged answer holds at
 * most {@code limit} entries, taking the first ones in direction order across all label sets.
 * Streams are emitted by label set, ascending for FORWARD and descending for BACKWARD.
 */
class StreamsMerger {

  static StreamsQueryResponse merge(List<StreamsQueryResponse> responses) {
    StreamsQueryResponse first = responses.get(0);
    return first.toBuilder()
        .clearResult()
        .result(mergeOrderedStreams(responses, first.getLimit(), first.getDirection()))
        .statistics(ResponseMerger.sumStatistics(responses))
        .build();
  }

  static List<LogStream> mergeOrderedStreams(
      List<StreamsQueryResponse> responses, long limit, Direction direction) {
    Map<String, List<List<Entry>>> groups = new HashMap<>();
    long total = 0;
    for (StreamsQueryResponse response : responses) {
      for (LogStream stream : response.getResult()) {
        groups.computeIfAbsent(stream.getLabels(), unused -> new ArrayList<>())
            .add(stream.getEntries());
        total += stream.getEntries().size();
      }
      // later answers cannot contribute once enough entries are known
      if (total >= limit) {
        break;
      }
    }

    List<String> keys = new ArrayList<>(groups.keySet());
    Collections.sort(keys);
    if (direction == Direction.BACKWARD) {
      Collections.reverse(keys);
    }
    Comparator<Entry> order = entryOrder(direction);

    if (total <= limit) {
      List<LogStream> result = new ArrayList<>(keys.size());
      for (String key : keys) {
        result.add(new LogStream(key, mergeInOrder(key, groups.get(key), order)));
      }
      return result;
    }

    PriorityQueue<Cursor> heads = new PriorityQueue<>(cursorOrder(order));
    for (String key : keys) {
      Cursor cursor = new Cursor(key, 0, mergeInOrder(key, groups.get(key), order));
      if (cursor.hasEntry()) {
        heads.add(cursor);
      }
    }
    Map<String, List<Entry>> taken = new LinkedHashMap<>();
    for (long count = 0; count < limit && !heads.isEmpty(); count++) {
      Cursor cursor = heads.poll();
      taken.computeIfAbsent(cursor.labels, unused -> new ArrayList<>()).add(cursor.head());
      cursor.advance();
      if (cursor.hasEntry()) {
        heads.add(cursor);
      }
    }

    List<LogStream> result = new ArrayList<>(taken.size());
    for (String key : keys) {
      List<Entry> entries = taken.get(key);
      if (entries != null) {
        result.add(new LogStream(key, List.copyOf(entries)));
      }
    }
    return result;
  }

  /** Interleaves the per-shard entry lists of one label set, each already in {@code order}. */
  private static List<Entry> mergeInOrder(
      String labels, List<List<Entry>> parts, Comparator<Entry> order) {
    if (parts.size() == 1) {
      return parts.get(0);
    }
    int size = parts.stream().mapToInt(List::size).sum();
    PriorityQueue<Cursor> heads = new PriorityQueue<>(cursorOrder(order));
    for (int i = 0; i < parts.size(); i++) {
      Cursor cursor = new Cursor(labels, i, parts.get(i));
      if (cursor.hasEntry()) {
        heads.add(cursor);
      }
    }
    List<Entry> merged = new ArrayList<>(size);
    while (!heads.isEmpty()) {
      Cursor cursor = heads.poll();
      merged.add(cursor.head());
      cursor.advance();
      if (cursor.hasEntry()) {
        heads.add(cursor);
      }
    }
    return merged;
  }

  private static Comparator<Entry> entryOrder(Direction direction) {
    Comparator<Entry> forward = Comparator.comparing(Entry::getTimestamp);
    return direction == Direction.FORWARD ? forward : forward.reversed();
  }

  // Ties on timestamp go to the smaller label set, then to the earlier shard.
  private static Comparator<Cursor> cursorOrder(Comparator<Entry> order) {
    return Comparator.<Cursor, Entry>comparing(Cursor::head, order)
        .thenComparing(cursor -> cursor.labels)
        .thenComparingInt(cursor -> cursor.source);
  }

  private static final class Cursor {
    private final String labels;
    private final int source;
    private final List<Entry> entries;
    private int position;

    private Cursor(String labels, int source, List<Entry> entries) {
      this.labels = labels;
      this.source = source;
      this.entries = entries;
    }

    boolean hasEntry() {
      return position < entries.size();
    }

    Entry head() {
      return entries.get(position);
    }

    void advance() {
      position++;
    }
  }
}
