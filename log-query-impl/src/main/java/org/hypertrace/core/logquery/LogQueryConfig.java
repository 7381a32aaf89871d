package org.hypertrace.core.logquery;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Locale;
import lombok.Value;
import lombok.experimental.NonFinal;
import okhttp3.HttpUrl;

@Value
@NonFinal
public class LogQueryConfig {
  private static final String CONFIG_PATH_SHARD = "shard";
  private static final String CONFIG_PATH_QUERY_DEFAULTS = "query.defaults";

  ShardClientConfig shardClientConfig;
  QueryDefaultsConfig queryDefaultsConfig;

  public LogQueryConfig(Config config) {
    Config resolved = config.resolve();
    this.shardClientConfig = new ShardClientConfig(resolved.getConfig(CONFIG_PATH_SHARD));
    this.queryDefaultsConfig =
        new QueryDefaultsConfig(resolved.getConfig(CONFIG_PATH_QUERY_DEFAULTS));
  }

  public int getMaxConcurrency() {
    return shardClientConfig.getMaxConcurrency();
  }

  /** Encoding in which sub-requests ask shards to answer. */
  public enum ShardEncoding {
    JSON,
    PROTOBUF
  }

  @Value
  @NonFinal
  public static class ShardClientConfig {
    private static final String CONFIG_PATH_ENDPOINT = "endpoint";
    private static final String CONFIG_PATH_ENCODING = "encoding";
    private static final String CONFIG_PATH_REQUEST_TIMEOUT = "requestTimeout";
    private static final String CONFIG_PATH_MAX_CONCURRENCY = "maxConcurrency";

    HttpUrl endpoint;
    ShardEncoding encoding;
    Duration requestTimeout;
    int maxConcurrency;

    private ShardClientConfig(Config config) {
      String endpoint = config.getString(CONFIG_PATH_ENDPOINT);
      this.endpoint = HttpUrl.parse(endpoint);
      if (this.endpoint == null) {
        throw new IllegalArgumentException("Invalid shard endpoint: " + endpoint);
      }
      this.encoding =
          ShardEncoding.valueOf(config.getString(CONFIG_PATH_ENCODING).toUpperCase(Locale.ROOT));
      this.requestTimeout = config.getDuration(CONFIG_PATH_REQUEST_TIMEOUT);
      this.maxConcurrency = config.getInt(CONFIG_PATH_MAX_CONCURRENCY);
      if (this.maxConcurrency <= 0) {
        throw new IllegalArgumentException(
            "maxConcurrency must be positive, got " + this.maxConcurrency);
      }
    }
  }

  @Value
  @NonFinal
  public static class QueryDefaultsConfig {
    private static final String CONFIG_PATH_LIMIT = "limit";
    private static final String CONFIG_PATH_LOOKBACK = "lookback";

    int limit;
    Duration lookback;

    private QueryDefaultsConfig(Config config) {
      this.limit = config.getInt(CONFIG_PATH_LIMIT);
      this.lookback = config.getDuration(CONFIG_PATH_LOOKBACK);
    }
  }
}
