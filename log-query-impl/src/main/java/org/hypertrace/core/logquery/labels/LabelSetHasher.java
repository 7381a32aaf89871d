package org.hypertrace.core.logquery.labels;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Stable 64-bit identity of a label set. Pairs are hashed in (name, value) order so that two label
 * sets with the same pairs hash equally whatever order they were received in.
 *
 * <p>Distinct label sets may collide. Callers deduplicating by this hash accept that a colliding
 * series is dropped.
 */
public class LabelSetHasher {
  private static final HashFunction HASH_FUNCTION = Hashing.farmHashFingerprint64();
  private static final byte SEPARATOR = (byte) 0xff;

  public static long hash(Map<String, String> labels) {
    return hash(labels.entrySet());
  }

  public static long hash(Collection<? extends Map.Entry<String, String>> labels) {
    List<Map.Entry<String, String>> sorted = new ArrayList<>(labels);
    sorted.sort(
        Map.Entry.<String, String>comparingByKey().thenComparing(Map.Entry.comparingByValue()));
    Hasher hasher = HASH_FUNCTION.newHasher();
    for (Map.Entry<String, String> label : sorted) {
      hasher.putString(label.getKey(), StandardCharsets.UTF_8);
      hasher.putByte(SEPARATOR);
      hasher.putString(label.getValue(), StandardCharsets.UTF_8);
      hasher.putByte(SEPARATOR);
    }
    return hasher.hash().asLong();
  }
}
