package org.hypertrace.core.logquery.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import io.grpc.StatusException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.api.HttpHeader;
import org.hypertrace.core.logquery.api.HttpRequest;
import org.hypertrace.core.logquery.api.HttpResponse;
import org.hypertrace.core.logquery.api.QueryResponse;
import org.hypertrace.core.logquery.api.util.LabelPairUtil;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.request.RequestKind;
import org.hypertrace.core.logquery.response.LogQueryResponse;
import org.hypertrace.core.logquery.response.QueryResponseHeader;
import org.hypertrace.core.logquery.response.SeriesQueryResponseView;

/**
 * Converts between HTTP responses and response variants. Shard answers are read in the encoding
 * named by their {@code Content-Type}; client answers are written in the encoding asked for by the
 * client's {@code Accept} header, JSON by default.
 */
@Slf4j
public class ResponseCodec {
  private static final int HTTP_OK = 200;
  private static final Set<String> NON_PASSTHROUGH_HEADERS =
      caseInsensitive(LogQueryHeaders.CONTENT_TYPE, "Content-Length");

  private final JsonResponseDecoder jsonDecoder;
  private final JsonResponseEncoder jsonEncoder;

  public ResponseCodec(ObjectMapper objectMapper) {
    this.jsonDecoder = new JsonResponseDecoder(objectMapper);
    this.jsonEncoder = new JsonResponseEncoder(objectMapper);
  }

  /**
   * @throws StatusException carrying the shard's status code and body if the shard did not answer
   *     with a 2xx status, INTERNAL if the body cannot be decoded
   */
  public LogQueryResponse decodeResponse(Response response, LogQueryRequest request)
      throws StatusException {
    byte[] body;
    try (ResponseBody responseBody = response.body()) {
      body = responseBody == null ? new byte[0] : responseBody.bytes();
    } catch (IOException e) {
      throw LogQueryErrors.internal("error decoding response: " + e.getMessage(), e);
    }
    return decode(response.code(), fromHeaders(response.headers()), body, request);
  }

  public LogQueryResponse decodeHttpGrpcResponse(HttpResponse response, LogQueryRequest request)
      throws StatusException {
    List<QueryResponseHeader> headers = new ArrayList<>();
    for (HttpHeader header : response.getHeadersList()) {
      headers.add(new QueryResponseHeader(header.getKey(), header.getValuesList()));
    }
    return decode(response.getCode(), headers, response.getBody().toByteArray(), request);
  }

  public Response encodeResponse(Request request, LogQueryResponse response)
      throws StatusException {
    EncodedBody encoded =
        encode(
            request.header(LogQueryHeaders.ACCEPT),
            ApiVersion.fromPath(request.url().encodedPath()),
            request.header(LogQueryHeaders.ENCODING_FLAGS),
            response);
    Response.Builder builder =
        new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(HTTP_OK)
            .message("OK")
            .header(LogQueryHeaders.CONTENT_TYPE, encoded.contentType)
            .body(ResponseBody.create(encoded.body, MediaType.get(encoded.contentType)));
    for (QueryResponseHeader header : passthroughHeaders(response)) {
      header.getValues().forEach(value -> builder.addHeader(header.getName(), value));
    }
    return builder.build();
  }

  public HttpResponse encodeHttpGrpcResponse(HttpRequest request, LogQueryResponse response)
      throws StatusException {
    Headers requestHeaders = toHeaders(request.getHeadersList());
    EncodedBody encoded =
        encode(
            requestHeaders.get(LogQueryHeaders.ACCEPT),
            ApiVersion.fromPath(request.getUrl()),
            requestHeaders.get(LogQueryHeaders.ENCODING_FLAGS),
            response);
    HttpResponse.Builder builder =
        HttpResponse.newBuilder()
            .setCode(HTTP_OK)
            .setBody(ByteString.copyFrom(encoded.body))
            .addHeaders(
                LabelPairUtil.createHttpHeader(
                    LogQueryHeaders.CONTENT_TYPE, List.of(encoded.contentType)));
    for (QueryResponseHeader header : passthroughHeaders(response)) {
      builder.addHeaders(LabelPairUtil.createHttpHeader(header.getName(), header.getValues()));
    }
    return builder.build();
  }

  private LogQueryResponse decode(
      int code, List<QueryResponseHeader> headers, byte[] body, LogQueryRequest request)
      throws StatusException {
    if (code / 100 != 2) {
      throw LogQueryErrors.fromHttpResponse(code, new String(body, StandardCharsets.UTF_8));
    }
    boolean protobuf =
        headers.stream()
            .filter(header -> header.getName().equalsIgnoreCase(LogQueryHeaders.CONTENT_TYPE))
            .flatMap(header -> header.getValues().stream())
            .anyMatch(value -> value.startsWith(LogQueryHeaders.PROTOBUF_TYPE));
    log.debug(
        "Decoding {} answer of a {} request", protobuf ? "protobuf" : "json", request.getKind());
    return protobuf
        ? decodeProtobuf(body, request, headers)
        : jsonDecoder.decode(body, request, headers);
  }

  private LogQueryResponse decodeProtobuf(
      byte[] body, LogQueryRequest request, List<QueryResponseHeader> headers)
      throws StatusException {
    // series answers are read lazily, without decoding the envelope
    if (request.getKind() == RequestKind.SERIES) {
      return SeriesQueryResponseView.of(body, headers);
    }
    QueryResponse envelope;
    try {
      envelope = QueryResponse.parseFrom(body);
    } catch (InvalidProtocolBufferException e) {
      throw LogQueryErrors.internal("error decoding response: " + e.getMessage(), e);
    }
    QueryResponse.ResponseCase expected;
    switch (request.getKind()) {
      case LABEL:
        expected = QueryResponse.ResponseCase.LABELS;
        break;
      case INDEX_STATS:
        expected = QueryResponse.ResponseCase.STATS;
        break;
      case VOLUME:
        expected = QueryResponse.ResponseCase.VOLUME;
        break;
      case RANGE:
      case INSTANT:
        return decodeQueryEnvelope(envelope, headers);
      default:
        throw LogQueryErrors.unsupportedKind("unsupported request kind " + request.getKind());
    }
    if (envelope.getResponseCase() != expected) {
      throw LogQueryErrors.internal(
          "unsupported response type, got " + envelope.getResponseCase());
    }
    return ProtobufResponseConverter.unwrap(envelope, headers);
  }

  private LogQueryResponse decodeQueryEnvelope(
      QueryResponse envelope, List<QueryResponseHeader> headers) throws StatusException {
    switch (envelope.getResponseCase()) {
      case PROM:
      case STREAMS:
      case TOPK_SKETCHES:
      case QUANTILE_SKETCHES:
        return ProtobufResponseConverter.unwrap(envelope, headers);
      default:
        throw LogQueryErrors.internal(
            "unsupported response type, got " + envelope.getResponseCase());
    }
  }

  private EncodedBody encode(
      String accept, ApiVersion version, String encodingFlags, LogQueryResponse response)
      throws StatusException {
    if (LogQueryHeaders.PROTOBUF_TYPE.equals(accept)) {
      return new EncodedBody(
          LogQueryHeaders.PROTOBUF_TYPE, ProtobufResponseConverter.encode(response));
    }
    boolean categorizeLabels =
        encodingFlags != null && encodingFlags.contains(LogQueryHeaders.FLAG_CATEGORIZE_LABELS);
    return new EncodedBody(
        LogQueryHeaders.JSON_TYPE, jsonEncoder.encode(response, version, categorizeLabels));
  }

  private static List<QueryResponseHeader> passthroughHeaders(LogQueryResponse response) {
    List<QueryResponseHeader> headers = new ArrayList<>();
    for (QueryResponseHeader header : response.getHeaders()) {
      if (!NON_PASSTHROUGH_HEADERS.contains(header.getName())) {
        headers.add(header);
      }
    }
    return headers;
  }

  private static List<QueryResponseHeader> fromHeaders(Headers headers) {
    List<QueryResponseHeader> converted = new ArrayList<>();
    for (String name : headers.names()) {
      converted.add(new QueryResponseHeader(name, headers.values(name)));
    }
    return converted;
  }

  private static Headers toHeaders(List<HttpHeader> headers) {
    Headers.Builder builder = new Headers.Builder();
    for (HttpHeader header : headers) {
      header.getValuesList().forEach(value -> builder.add(header.getKey(), value));
    }
    return builder.build();
  }

  private static Set<String> caseInsensitive(String... values) {
    Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    set.addAll(List.of(values));
    return set;
  }

  private static class EncodedBody {
    private final String contentType;
    private final byte[] body;

    private EncodedBody(String contentType, byte[] body) {
      this.contentType = contentType;
      this.body = body;
    }
  }
}
