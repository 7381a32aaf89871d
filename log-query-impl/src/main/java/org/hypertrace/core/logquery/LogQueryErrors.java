package org.hypertrace.core.logquery;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.util.Optional;

/**
 * Factory for the errors raised by the codecs and the merger. Every error is a gRPC {@link
 * StatusException} whose trailers carry the HTTP status code that should be relayed to the client,
 * so that a shard's non-2xx answer can be proxied verbatim.
 */
public class LogQueryErrors {
  public static final Metadata.Key<String> HTTP_STATUS_KEY =
      Metadata.Key.of("x-http-status", Metadata.ASCII_STRING_MARSHALLER);

  private static final int BAD_REQUEST = 400;
  private static final int UNAUTHORIZED = 401;
  private static final int NOT_FOUND = 404;
  private static final int INTERNAL_SERVER_ERROR = 500;

  public static StatusException badRequest(String description) {
    return withHttpStatus(Status.INVALID_ARGUMENT, BAD_REQUEST, description);
  }

  public static StatusException notFound(String description) {
    return withHttpStatus(Status.NOT_FOUND, NOT_FOUND, description);
  }

  public static StatusException unauthenticated(String description) {
    return withHttpStatus(Status.UNAUTHENTICATED, UNAUTHORIZED, description);
  }

  public static StatusException internal(String description) {
    return withHttpStatus(Status.INTERNAL, INTERNAL_SERVER_ERROR, description);
  }

  public static StatusException internal(String description, Throwable cause) {
    return withHttpStatus(
        Status.INTERNAL.withCause(cause), INTERNAL_SERVER_ERROR, description);
  }

  public static StatusException unsupportedKind(String description) {
    return withHttpStatus(Status.UNIMPLEMENTED, INTERNAL_SERVER_ERROR, description);
  }

  /** Converts a non-2xx HTTP answer into an error that keeps both the code and the raw body. */
  public static StatusException fromHttpResponse(int httpCode, String body) {
    return withHttpStatus(statusForHttpCode(httpCode), httpCode, body);
  }

  /** Returns the HTTP status code a client should see for the given failure. */
  public static int httpStatusOf(Throwable throwable) {
    Status status;
    Metadata trailers;
    if (throwable instanceof StatusException) {
      status = ((StatusException) throwable).getStatus();
      trailers = ((StatusException) throwable).getTrailers();
    } else if (throwable instanceof StatusRuntimeException) {
      status = ((StatusRuntimeException) throwable).getStatus();
      trailers = ((StatusRuntimeException) throwable).getTrailers();
    } else {
      return INTERNAL_SERVER_ERROR;
    }
    return Optional.ofNullable(trailers)
        .map(metadata -> metadata.get(HTTP_STATUS_KEY))
        .map(Integer::parseInt)
        .orElseGet(() -> httpCodeForStatus(status.getCode()));
  }

  private static StatusException withHttpStatus(Status status, int httpCode, String description) {
    Metadata trailers = new Metadata();
    trailers.put(HTTP_STATUS_KEY, String.valueOf(httpCode));
    return status.withDescription(description).asException(trailers);
  }

  private static Status statusForHttpCode(int httpCode) {
    switch (httpCode) {
      case BAD_REQUEST:
        return Status.INVALID_ARGUMENT;
      case UNAUTHORIZED:
        return Status.UNAUTHENTICATED;
      case 403:
        return Status.PERMISSION_DENIED;
      case NOT_FOUND:
        return Status.NOT_FOUND;
      case 408:
      case 504:
        return Status.DEADLINE_EXCEEDED;
      case 429:
        return Status.RESOURCE_EXHAUSTED;
      case 499:
        return Status.CANCELLED;
      case 501:
        return Status.UNIMPLEMENTED;
      case 503:
        return Status.UNAVAILABLE;
      default:
        if (httpCode >= 400 && httpCode < 500) {
          return Status.FAILED_PRECONDITION;
        }
        return httpCode >= 500 ? Status.INTERNAL : Status.UNKNOWN;
    }
  }

  private static int httpCodeForStatus(Status.Code code) {
    switch (code) {
      case INVALID_ARGUMENT:
        return BAD_REQUEST;
      case UNAUTHENTICATED:
        return UNAUTHORIZED;
      case NOT_FOUND:
        return NOT_FOUND;
      default:
        return INTERNAL_SERVER_ERROR;
    }
  }
}
