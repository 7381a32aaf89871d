package org.hypertrace.core.logquery;

import static java.util.Objects.requireNonNull;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LogQueryConfigTest {
  private Config appConfig;
  private LogQueryConfig logQueryConfig;

  @BeforeEach
  public void setup() {
    appConfig =
        ConfigFactory.parseURL(
            requireNonNull(
                LogQueryConfigTest.class.getClassLoader().getResource("application.conf")));
    logQueryConfig = new LogQueryConfig(appConfig.getConfig("service.config"));
  }

  @Test
  public void testLogQueryConfigParser() {
    assertEquals("log-query-frontend", appConfig.getString("service.name"));

    LogQueryConfig.ShardClientConfig shard = logQueryConfig.getShardClientConfig();
    assertEquals("query-shard", shard.getEndpoint().host());
    assertEquals(3100, shard.getEndpoint().port());
    assertEquals(LogQueryConfig.ShardEncoding.PROTOBUF, shard.getEncoding());
    assertEquals(Duration.ofSeconds(5), shard.getRequestTimeout());
    assertEquals(4, logQueryConfig.getMaxConcurrency());

    LogQueryConfig.QueryDefaultsConfig defaults = logQueryConfig.getQueryDefaultsConfig();
    assertEquals(50, defaults.getLimit());
    assertEquals(Duration.ofHours(2), defaults.getLookback());
  }

  @Test
  public void testEncodingIsCaseInsensitive() {
    Config config =
        ConfigFactory.parseString("shard.encoding = Json")
            .withFallback(appConfig.getConfig("service.config"));

    assertEquals(
        LogQueryConfig.ShardEncoding.JSON,
        new LogQueryConfig(config).getShardClientConfig().getEncoding());
  }

  @Test
  public void testInvalidShardSettings() {
    Config badEndpoint =
        ConfigFactory.parseString("shard.endpoint = \"query-shard:3100\"")
            .withFallback(appConfig.getConfig("service.config"));
    Config noConcurrency =
        ConfigFactory.parseString("shard.maxConcurrency = 0")
            .withFallback(appConfig.getConfig("service.config"));

    assertThrows(IllegalArgumentException.class, () -> new LogQueryConfig(badEndpoint));
    assertThrows(IllegalArgumentException.class, () -> new LogQueryConfig(noConcurrency));
  }
}
