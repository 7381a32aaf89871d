package org.hypertrace.core.logquery.transport;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

@Slf4j
public class OkHttpShardTransport implements ShardTransport {
  private final OkHttpClient okHttpClient;

  @Inject
  public OkHttpShardTransport(OkHttpClient okHttpClient) {
    this.okHttpClient = okHttpClient;
  }

  @Override
  public CompletableFuture<Response> execute(Request request) {
    OkHttpResponseCallback callback = new OkHttpResponseCallback(request);
    okHttpClient.newCall(request).enqueue(callback);
    return callback.future;
  }

  private static class OkHttpResponseCallback implements Callback {
    private final CompletableFuture<Response> future = new CompletableFuture<>();
    private final Request request;

    OkHttpResponseCallback(Request request) {
      this.request = request;
    }

    @Override
    public void onResponse(Call call, Response response) {
      future.complete(response);
    }

    @Override
    public void onFailure(Call call, IOException e) {
      log.error("Shard request to {} failed", request.url(), e);
      future.completeExceptionally(e);
    }
  }
}
