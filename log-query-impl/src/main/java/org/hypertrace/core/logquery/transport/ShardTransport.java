package org.hypertrace.core.logquery.transport;

import java.util.concurrent.CompletableFuture;
import okhttp3.Request;
import okhttp3.Response;

/** Sends an encoded sub-request to the shard that serves it. */
public interface ShardTransport {

  /**
   * The returned future completes with the shard's HTTP answer, whatever its status code, or
   * exceptionally if no answer could be obtained. The caller owns and must close the response.
   */
  CompletableFuture<Response> execute(Request request);
}
