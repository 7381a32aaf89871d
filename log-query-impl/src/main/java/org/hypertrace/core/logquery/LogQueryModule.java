package org.hypertrace.core.logquery;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;
import org.hypertrace.core.logquery.codec.HttpQueryParser;
import org.hypertrace.core.logquery.codec.ProtobufRequestCodec;
import org.hypertrace.core.logquery.codec.RequestCodec;
import org.hypertrace.core.logquery.codec.ResponseCodec;
import org.hypertrace.core.logquery.merge.ResponseMerger;
import org.hypertrace.core.logquery.transport.OkHttpShardTransport;
import org.hypertrace.core.logquery.transport.ShardTransport;

public class LogQueryModule extends AbstractModule {

  private final LogQueryConfig config;

  public LogQueryModule(Config config) {
    this.config = new LogQueryConfig(config);
  }

  @Override
  protected void configure() {
    bind(LogQueryConfig.class).toInstance(this.config);
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(ResponseMerger.class).in(Singleton.class);
    bind(ShardTransport.class).to(OkHttpShardTransport.class).in(Singleton.class);
  }

  /** Mapper for JSON bodies. Floats are read as decimals so values keep their precision. */
  public static ObjectMapper newObjectMapper() {
    return new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Provides
  @Singleton
  ObjectMapper provideObjectMapper() {
    return newObjectMapper();
  }

  @Provides
  @Singleton
  MeterRegistry provideMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Provides
  @Singleton
  HttpQueryParser provideQueryParser(Clock clock) {
    LogQueryConfig.QueryDefaultsConfig defaults = config.getQueryDefaultsConfig();
    return new HttpQueryParser(defaults.getLimit(), defaults.getLookback(), clock);
  }

  @Provides
  @Singleton
  RequestCodec provideRequestCodec(HttpQueryParser parser) {
    LogQueryConfig.ShardClientConfig shard = config.getShardClientConfig();
    switch (shard.getEncoding()) {
      case PROTOBUF:
        return new ProtobufRequestCodec(parser, shard.getEndpoint());
      case JSON:
      default:
        return new RequestCodec(parser, shard.getEndpoint());
    }
  }

  @Provides
  @Singleton
  ResponseCodec provideResponseCodec(ObjectMapper objectMapper) {
    return new ResponseCodec(objectMapper);
  }

  @Provides
  @Singleton
  OkHttpClient provideOkHttpClient() {
    return new OkHttpClient.Builder()
        .callTimeout(config.getShardClientConfig().getRequestTimeout())
        .build();
  }
}
