package org.hypertrace.core.logquery.transport;

import io.grpc.StatusException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Request;
import okhttp3.Response;
import org.hypertrace.core.logquery.LogQueryConfig;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.QueryContext;
import org.hypertrace.core.logquery.codec.RequestCodec;
import org.hypertrace.core.logquery.codec.ResponseCodec;
import org.hypertrace.core.logquery.merge.ResponseMerger;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.response.LogQueryResponse;

/**
 * Runs the sub-requests of one query against their shards and merges the answers. At most {@code
 * maxConcurrency} shard calls are in flight at a time; answers are merged in sub-request order
 * regardless of which shard replies first. Any failed shard fails the whole query.
 */
@Slf4j
@Singleton
public class ShardedQueryExecutor {
  static final String SHARD_REQUESTS_COUNTER = "log.query.shard.requests";

  private final RequestCodec requestCodec;
  private final ResponseCodec responseCodec;
  private final ResponseMerger responseMerger;
  private final ShardTransport transport;
  private final int maxConcurrency;
  private final Counter shardErrorCounter;
  private final Counter shardSuccessCounter;

  @Inject
  public ShardedQueryExecutor(
      RequestCodec requestCodec,
      ResponseCodec responseCodec,
      ResponseMerger responseMerger,
      ShardTransport transport,
      MeterRegistry meterRegistry,
      LogQueryConfig config) {
    this.requestCodec = requestCodec;
    this.responseCodec = responseCodec;
    this.responseMerger = responseMerger;
    this.transport = transport;
    this.maxConcurrency = config.getMaxConcurrency();
    this.shardErrorCounter =
        Counter.builder(SHARD_REQUESTS_COUNTER).tag("error", "true").register(meterRegistry);
    this.shardSuccessCounter =
        Counter.builder(SHARD_REQUESTS_COUNTER).tag("error", "false").register(meterRegistry);
  }

  public Single<LogQueryResponse> execute(
      List<? extends LogQueryRequest> subRequests, QueryContext context) {
    return Single.defer(
        () -> {
          if (subRequests.isEmpty()) {
            return Single.error(LogQueryErrors.badRequest("no sub-requests to execute"));
          }
          return Observable.fromIterable(subRequests)
              .concatMapEager(
                  subRequest -> executeOne(subRequest, context).toObservable(),
                  maxConcurrency,
                  1)
              .toList()
              .map(responseMerger::merge);
        });
  }

  private Single<LogQueryResponse> executeOne(LogQueryRequest subRequest, QueryContext context) {
    return Single.fromCallable(() -> requestCodec.encodeRequest(subRequest, context))
        .flatMap(
            httpRequest ->
                call(httpRequest).map(response -> decode(httpRequest, response, subRequest)))
        .doOnSuccess(unused -> shardSuccessCounter.increment())
        .doOnError(
            error -> {
              log.error("Shard request failed: {}", subRequest.describe(), error);
              shardErrorCounter.increment();
            });
  }

  /** Answers that arrive after the call was disposed are closed here. */
  private Single<Response> call(Request httpRequest) {
    return Single.defer(
        () -> {
          CompletableFuture<Response> future = transport.execute(httpRequest);
          AtomicBoolean delivered = new AtomicBoolean();
          return Single.fromCompletionStage(future)
              .doOnSuccess(unused -> delivered.set(true))
              .doOnDispose(
                  () ->
                      future.whenComplete(
                          (response, error) -> {
                            if (response != null && delivered.compareAndSet(false, true)) {
                              log.debug(
                                  "Closing late answer of cancelled shard request {}",
                                  httpRequest.url());
                              response.close();
                            }
                          }));
        });
  }

  private LogQueryResponse decode(Request httpRequest, Response response, LogQueryRequest request)
      throws StatusException {
    try (response) {
      log.debug("Shard {} answered with status {}", httpRequest.url(), response.code());
      return responseCodec.decodeResponse(response, request);
    }
  }
}
