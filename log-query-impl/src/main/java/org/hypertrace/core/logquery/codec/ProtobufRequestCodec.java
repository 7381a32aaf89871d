package org.hypertrace.core.logquery.codec;

import io.grpc.StatusException;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.QueryContext;
import org.hypertrace.core.logquery.request.LogQueryRequest;

/** Request codec asking shards to answer in the binary encoding. */
public class ProtobufRequestCodec extends RequestCodec {

  public ProtobufRequestCodec(HttpQueryParser parser, HttpUrl shardBaseUrl) {
    super(parser, shardBaseUrl);
  }

  @Override
  public Request encodeRequest(LogQueryRequest request, QueryContext context)
      throws StatusException {
    return super.encodeRequest(request, context)
        .newBuilder()
        .header(LogQueryHeaders.ACCEPT, LogQueryHeaders.PROTOBUF_TYPE)
        .build();
  }
}
