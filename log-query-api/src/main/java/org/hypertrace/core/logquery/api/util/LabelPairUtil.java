package org.hypertrace.core.logquery.api.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.logquery.api.HttpHeader;
import org.hypertrace.core.logquery.api.LabelPair;
import org.hypertrace.core.logquery.api.ResponseHeader;

/** Utility methods to move label sets and headers in and out of the wire messages. */
public class LabelPairUtil {

  /** Converts a label map into label pairs sorted by name. */
  public static List<LabelPair> fromMap(Map<String, String> labels) {
    return labels.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .map(entry -> createLabelPair(entry.getKey(), entry.getValue()))
        .collect(Collectors.toUnmodifiableList());
  }

  /** Converts label pairs into a map, keeping the order of the pairs. Later duplicates win. */
  public static Map<String, String> toMap(Collection<LabelPair> labelPairs) {
    Map<String, String> labels = new LinkedHashMap<>();
    for (LabelPair labelPair : labelPairs) {
      labels.put(labelPair.getName(), labelPair.getValue());
    }
    return labels;
  }

  public static LabelPair createLabelPair(String name, String value) {
    return LabelPair.newBuilder().setName(name).setValue(value).build();
  }

  public static ResponseHeader createResponseHeader(String name, List<String> values) {
    return ResponseHeader.newBuilder().setName(name).addAllValues(values).build();
  }

  public static HttpHeader createHttpHeader(String key, List<String> values) {
    return HttpHeader.newBuilder().setKey(key).addAllValues(values).build();
  }

  public static Comparator<LabelPair> byName() {
    return Comparator.comparing(LabelPair::getName).thenComparing(LabelPair::getValue);
  }
}
