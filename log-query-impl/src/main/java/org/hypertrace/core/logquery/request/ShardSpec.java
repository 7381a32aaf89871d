package org.hypertrace.core.logquery.request;

import com.google.common.base.Preconditions;
import lombok.Value;

/** One shard out of a fixed shard count, encoded as {@code <shard>_of_<of>}. */
@Value
public class ShardSpec {
  private static final String SEPARATOR = "_of_";

  int shard;
  int of;

  public ShardSpec(int shard, int of) {
    Preconditions.checkArgument(of > 0, "shard count must be positive, got %s", of);
    Preconditions.checkArgument(
        shard >= 0 && shard < of, "shard %s is out of range for %s shards", shard, of);
    this.shard = shard;
    this.of = of;
  }

  public String encode() {
    return shard + SEPARATOR + of;
  }

  /**
   * @throws IllegalArgumentException if the value is not an encoded shard
   */
  public static ShardSpec parse(String encoded) {
    int separator = encoded.indexOf(SEPARATOR);
    if (separator <= 0) {
      throw new IllegalArgumentException("invalid shard: " + encoded);
    }
    try {
      return new ShardSpec(
          Integer.parseInt(encoded.substring(0, separator)),
          Integer.parseInt(encoded.substring(separator + SEPARATOR.length())));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid shard: " + encoded, e);
    }
  }
}
