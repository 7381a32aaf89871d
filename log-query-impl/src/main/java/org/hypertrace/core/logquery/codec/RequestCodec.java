package org.hypertrace.core.logquery.codec;

import com.google.gson.JsonParseException;
import io.grpc.StatusException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.LogQueryHeaders;
import org.hypertrace.core.logquery.QueryContext;
import org.hypertrace.core.logquery.QueryLimits;
import org.hypertrace.core.logquery.api.HttpHeader;
import org.hypertrace.core.logquery.api.HttpRequest;
import org.hypertrace.core.logquery.request.IndexStatsQueryRequest;
import org.hypertrace.core.logquery.request.InstantQueryRequest;
import org.hypertrace.core.logquery.request.LabelQueryRequest;
import org.hypertrace.core.logquery.request.LogQueryRequest;
import org.hypertrace.core.logquery.request.QueryRoute;
import org.hypertrace.core.logquery.request.RangeQueryRequest;
import org.hypertrace.core.logquery.request.SeriesQueryRequest;
import org.hypertrace.core.logquery.request.VolumeQueryRequest;

/**
 * Converts between HTTP requests and request variants. Decoding routes on the URL path; encoding
 * always targets the v1 API of a shard located at {@code shardBaseUrl}.
 */
@Slf4j
public class RequestCodec {
  private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

  private final HttpQueryParser parser;
  private final HttpUrl shardBaseUrl;

  public RequestCodec(HttpQueryParser parser, HttpUrl shardBaseUrl) {
    this.parser = parser;
    this.shardBaseUrl = shardBaseUrl;
  }

  public LogQueryRequest decodeRequest(Request request, QueryContext context)
      throws StatusException {
    QueryParameters params = QueryParameters.fromUrl(request.url());
    if (request.body() instanceof FormBody) {
      params = QueryParameters.fromFormBody((FormBody) request.body()).followedBy(params);
    }
    return decode(request.url().encodedPath(), params);
  }

  /**
   * Decodes an HTTP request wrapped in a protobuf message. The returned context is {@code context}
   * completed with the tenant, query tags, queue time, encoding flags, actor path and query limits
   * carried by the wrapped headers; values already in {@code context} win.
   */
  public DecodedRequest decodeHttpGrpcRequest(HttpRequest request, QueryContext context)
      throws StatusException {
    HttpUrl url = shardBaseUrl.resolve(request.getUrl());
    if (url == null) {
      throw LogQueryErrors.badRequest("invalid request url: " + request.getUrl());
    }
    Headers headers = toHeaders(request.getHeadersList());
    QueryContext enriched = enrichContext(context, headers);

    QueryParameters params = QueryParameters.fromUrl(url);
    String contentType = headers.get(LogQueryHeaders.CONTENT_TYPE);
    if (contentType != null && contentType.startsWith(FORM_CONTENT_TYPE)) {
      params = QueryParameters.fromForm(request.getBody().toStringUtf8()).followedBy(params);
    }
    return new DecodedRequest(decode(url.encodedPath(), params), enriched);
  }

  public Request encodeRequest(LogQueryRequest request, QueryContext context)
      throws StatusException {
    Headers.Builder headers = new Headers.Builder();
    context.getQueryTags().ifPresent(tags -> headers.set(LogQueryHeaders.QUERY_TAGS, tags));
    if (!context.getEncodingFlags().isEmpty()) {
      headers.set(
          LogQueryHeaders.ENCODING_FLAGS,
          context.getEncodingFlags().stream().sorted().collect(Collectors.joining(",")));
    }
    context.getActorPath().ifPresent(actor -> headers.set(LogQueryHeaders.ACTOR_PATH, actor));
    context
        .getQueryLimits()
        .ifPresent(limits -> headers.set(LogQueryHeaders.QUERY_LIMITS, limits.toHeaderValue()));
    String tenantId =
        context
            .getTenantId()
            .orElseThrow(() -> LogQueryErrors.unauthenticated("no org id"));
    headers.set(LogQueryHeaders.ORG_ID, tenantId);

    return new Request.Builder().url(encodeUrl(request)).headers(headers.build()).get().build();
  }

  /** Path a request is sent to, used to label logs and metrics. */
  public String path(LogQueryRequest request) {
    switch (request.getKind()) {
      case LABEL:
        return request.getPath();
      case VOLUME:
        return QueryRoute.VOLUME_RANGE.getPath();
      default:
        return canonicalPath(request);
    }
  }

  private LogQueryRequest decode(String path, QueryParameters params) throws StatusException {
    QueryRoute route =
        QueryRoute.fromPath(path)
            .orElseThrow(() -> LogQueryErrors.notFound("unknown request path: " + path));
    log.debug("Decoding {} request received on {}", route, path);
    switch (route) {
      case QUERY_RANGE:
        return parser.parseRangeQuery(params, path);
      case INSTANT_QUERY:
        return parser.parseInstantQuery(params, path);
      case SERIES:
        return parser.parseSeriesQuery(params, path);
      case LABEL_NAMES:
        return parser.parseLabelQuery(params, path);
      case INDEX_STATS:
        return parser.parseIndexStatsQuery(params);
      case VOLUME:
        return parser.parseVolumeQuery(params, false);
      case VOLUME_RANGE:
        return parser.parseVolumeQuery(params, true);
      default:
        throw LogQueryErrors.notFound("unknown request path: " + path);
    }
  }

  private HttpUrl encodeUrl(LogQueryRequest request) throws StatusException {
    HttpUrl.Builder url = shardBaseUrl.newBuilder();
    switch (request.getKind()) {
      case RANGE:
        RangeQueryRequest range = (RangeQueryRequest) request;
        url.encodedPath(QueryRoute.QUERY_RANGE.getPath())
            .addQueryParameter("start", nanos(range.getStart()))
            .addQueryParameter("end", nanos(range.getEnd()))
            .addQueryParameter("query", range.getQuery())
            .addQueryParameter("direction", range.getDirection().name())
            .addQueryParameter("limit", String.valueOf(range.getLimit()));
        range.getShards().forEach(shard -> url.addQueryParameter("shards", shard));
        if (range.getStep() != 0) {
          url.addQueryParameter("step", seconds(range.getStep()));
        }
        if (range.getInterval() != 0) {
          url.addQueryParameter("interval", seconds(range.getInterval()));
        }
        return url.build();
      case INSTANT:
        InstantQueryRequest instant = (InstantQueryRequest) request;
        url.encodedPath(QueryRoute.INSTANT_QUERY.getPath())
            .addQueryParameter("query", instant.getQuery())
            .addQueryParameter("direction", instant.getDirection().name())
            .addQueryParameter("limit", String.valueOf(instant.getLimit()))
            .addQueryParameter("time", nanos(instant.getTime()));
        instant.getShards().forEach(shard -> url.addQueryParameter("shards", shard));
        return url.build();
      case SERIES:
        SeriesQueryRequest series = (SeriesQueryRequest) request;
        url.encodedPath(QueryRoute.SERIES.getPath())
            .addQueryParameter("start", nanos(series.getStart()))
            .addQueryParameter("end", nanos(series.getEnd()));
        series.getMatch().forEach(match -> url.addQueryParameter("match[]", match));
        series.getShards().forEach(shard -> url.addQueryParameter("shards", shard));
        return url.build();
      case LABEL:
        LabelQueryRequest label = (LabelQueryRequest) request;
        // either /labels or /label/{name}/values, forwarded as received
        return url.encodedPath(label.getPath())
            .addQueryParameter("start", nanos(label.getStart()))
            .addQueryParameter("end", nanos(label.getEnd()))
            .addQueryParameter("query", label.getQuery())
            .build();
      case INDEX_STATS:
        IndexStatsQueryRequest stats = (IndexStatsQueryRequest) request;
        return url.encodedPath(QueryRoute.INDEX_STATS.getPath())
            .addQueryParameter("start", nanos(stats.getFrom()))
            .addQueryParameter("end", nanos(stats.getThrough()))
            .addQueryParameter("query", stats.getMatchers())
            .build();
      case VOLUME:
        VolumeQueryRequest volume = (VolumeQueryRequest) request;
        url.encodedPath(volume.getPath())
            .addQueryParameter("start", nanos(volume.getFrom()))
            .addQueryParameter("end", nanos(volume.getThrough()))
            .addQueryParameter("query", volume.getMatchers())
            .addQueryParameter("limit", String.valueOf(volume.getLimit()))
            .addQueryParameter("aggregateBy", volume.getAggregateBy());
        if (!volume.getTargetLabels().isEmpty()) {
          url.addQueryParameter("targetLabels", String.join(",", volume.getTargetLabels()));
        }
        if (volume.isRange()) {
          url.addQueryParameter("step", seconds(volume.getStep()));
        }
        return url.build();
      default:
        throw LogQueryErrors.internal("invalid request format, got " + request.getKind());
    }
  }

  private static String canonicalPath(LogQueryRequest request) {
    switch (request.getKind()) {
      case RANGE:
        return QueryRoute.QUERY_RANGE.getPath();
      case INSTANT:
        return QueryRoute.INSTANT_QUERY.getPath();
      case SERIES:
        return QueryRoute.SERIES.getPath();
      case INDEX_STATS:
        return QueryRoute.INDEX_STATS.getPath();
      default:
        return request.getPath();
    }
  }

  private QueryContext enrichContext(QueryContext context, Headers headers)
      throws StatusException {
    QueryContext.QueryContextBuilder builder = context.toBuilder();
    if (context.getTenantId().isEmpty()) {
      String tenantId = headers.get(LogQueryHeaders.ORG_ID);
      if (StringUtils.isEmpty(tenantId)) {
        throw LogQueryErrors.unauthenticated("no org id");
      }
      builder.tenantId(tenantId);
    }
    String queryTags = headers.get(LogQueryHeaders.QUERY_TAGS);
    if (StringUtils.isNotEmpty(queryTags)) {
      builder.queryTags(queryTags);
    }
    Optional.ofNullable(headers.get(LogQueryHeaders.QUEUE_TIME))
        .flatMap(RequestCodec::parseQueueTime)
        .ifPresent(builder::queueTime);
    if (context.getEncodingFlags().isEmpty()) {
      Optional.ofNullable(headers.get(LogQueryHeaders.ENCODING_FLAGS))
          .map(RequestCodec::splitFlags)
          .ifPresent(builder::encodingFlags);
    }
    if (context.getActorPath().isEmpty()) {
      Optional.ofNullable(headers.get(LogQueryHeaders.ACTOR_PATH)).ifPresent(builder::actorPath);
    }
    if (context.getQueryLimits().isEmpty()) {
      Optional.ofNullable(headers.get(LogQueryHeaders.QUERY_LIMITS))
          .flatMap(RequestCodec::parseQueryLimits)
          .ifPresent(builder::queryLimits);
    }
    return builder.build();
  }

  private static Optional<Duration> parseQueueTime(String value) {
    try {
      return Optional.of(DurationStrings.parseGoDuration(value));
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring unparseable {} header: {}", LogQueryHeaders.QUEUE_TIME, value);
      return Optional.empty();
    }
  }

  private static Optional<QueryLimits> parseQueryLimits(String value) {
    try {
      return Optional.ofNullable(QueryLimits.fromHeaderValue(value));
    } catch (JsonParseException e) {
      log.warn("Ignoring unparseable {} header: {}", LogQueryHeaders.QUERY_LIMITS, value);
      return Optional.empty();
    }
  }

  private static List<String> splitFlags(String value) {
    return Arrays.stream(value.split(","))
        .map(flag -> flag.trim().toLowerCase(Locale.ROOT))
        .filter(flag -> !flag.isEmpty())
        .collect(Collectors.toList());
  }

  private static Headers toHeaders(List<HttpHeader> headers) {
    Headers.Builder builder = new Headers.Builder();
    for (HttpHeader header : headers) {
      for (String value : header.getValuesList()) {
        builder.add(header.getKey(), value);
      }
    }
    return builder.build();
  }

  private static String nanos(Instant instant) {
    return String.valueOf(instant.getEpochSecond() * 1_000_000_000L + instant.getNano());
  }

  /** Milliseconds as fractional seconds with six decimals. */
  private static String seconds(long millis) {
    return String.format(Locale.ROOT, "%f", millis / 1e3);
  }
}
