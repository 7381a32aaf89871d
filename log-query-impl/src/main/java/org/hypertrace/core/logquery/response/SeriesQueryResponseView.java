package org.hypertrace.core.logquery.response;

import com.google.common.collect.AbstractIterator;
import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import io.grpc.StatusException;
import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.LogQueryErrors;
import org.hypertrace.core.logquery.api.LabelPair;
import org.hypertrace.core.logquery.api.QueryResponse;
import org.hypertrace.core.logquery.api.SeriesResponse;
import org.hypertrace.core.logquery.api.Statistics;
import org.hypertrace.core.logquery.labels.LabelSetHasher;

/**
 * Series answer read straight from the binary envelope. Only the location of the series message is
 * resolved up front; identifiers and their labels are parsed while iterating, without copying the
 * underlying bytes.
 */
public class SeriesQueryResponseView
    implements LogQueryResponse, Iterable<SeriesQueryResponseView.SeriesIdentifierView> {
  private static final int TAG_TYPE_BITS = 3;
  private static final int WIRETYPE_LENGTH_DELIMITED = 2;

  private final ByteString series;
  private final List<QueryResponseHeader> headers;

  private SeriesQueryResponseView(ByteString series, List<QueryResponseHeader> headers) {
    this.series = series;
    this.headers = List.copyOf(headers);
  }

  /**
   * @param envelope an encoded {@link QueryResponse} holding a series answer
   * @throws StatusException INTERNAL if the envelope is malformed or holds another answer
   */
  public static SeriesQueryResponseView of(byte[] envelope, List<QueryResponseHeader> headers)
      throws StatusException {
    try {
      CodedInputStream input = newInput(ByteString.copyFrom(envelope));
      int tag;
      while ((tag = input.readTag()) != 0) {
        if (fieldNumber(tag) == QueryResponse.SERIES_FIELD_NUMBER
            && (tag & ((1 << TAG_TYPE_BITS) - 1)) == WIRETYPE_LENGTH_DELIMITED) {
          return new SeriesQueryResponseView(input.readBytes(), headers);
        }
        input.skipField(tag);
      }
    } catch (IOException e) {
      throw LogQueryErrors.internal("error decoding series response: " + e.getMessage(), e);
    }
    throw LogQueryErrors.internal("binary response does not hold a series answer");
  }

  @Override
  public ResponseKind getKind() {
    return ResponseKind.SERIES_VIEW;
  }

  @Override
  public String getStatus() {
    return readField(SeriesResponse.STATUS_FIELD_NUMBER)
        .map(ByteString::toStringUtf8)
        .orElse("");
  }

  public int getVersion() {
    CodedInputStream input = newInput(series);
    int version = 0;
    try {
      int tag;
      while ((tag = input.readTag()) != 0) {
        if (fieldNumber(tag) == SeriesResponse.VERSION_FIELD_NUMBER) {
          version = input.readUInt32();
        } else {
          input.skipField(tag);
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("malformed series response", e);
    }
    return version;
  }

  @Override
  public List<QueryResponseHeader> getHeaders() {
    return headers;
  }

  @Override
  public QueryStatistics getStatistics() {
    return readField(SeriesResponse.STATISTICS_FIELD_NUMBER)
        .map(
            bytes -> {
              try {
                return QueryStatistics.fromProto(Statistics.parseFrom(bytes));
              } catch (IOException e) {
                throw new IllegalStateException("malformed statistics", e);
              }
            })
        .orElse(QueryStatistics.EMPTY);
  }

  @Override
  public SeriesQueryResponseView withHeaders(List<QueryResponseHeader> headers) {
    return new SeriesQueryResponseView(series, headers);
  }

  /** Iterates the series identifiers in wire order, duplicates included. */
  @Override
  public Iterator<SeriesIdentifierView> iterator() {
    CodedInputStream input = newInput(series);
    return new AbstractIterator<SeriesIdentifierView>() {
      @Override
      protected SeriesIdentifierView computeNext() {
        try {
          int tag;
          while ((tag = input.readTag()) != 0) {
            if (fieldNumber(tag) == SeriesResponse.DATA_FIELD_NUMBER) {
              return new SeriesIdentifierView(input.readBytes());
            }
            input.skipField(tag);
          }
          return endOfData();
        } catch (IOException e) {
          throw new IllegalStateException("malformed series response", e);
        }
      }
    };
  }

  /** Fully decodes the view. */
  public SeriesQueryResponse materialize() {
    SeriesQueryResponse.SeriesQueryResponseBuilder builder =
        SeriesQueryResponse.builder()
            .status(getStatus())
            .version(ApiVersion.fromValue(getVersion()))
            .headers(headers)
            .statistics(getStatistics());
    for (SeriesIdentifierView identifier : this) {
      builder.series(identifier.materialize());
    }
    return builder.build();
  }

  private Optional<ByteString> readField(int fieldNumber) {
    CodedInputStream input = newInput(series);
    ByteString value = null;
    try {
      int tag;
      while ((tag = input.readTag()) != 0) {
        if (fieldNumber(tag) == fieldNumber) {
          value = input.readBytes();
        } else {
          input.skipField(tag);
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("malformed series response", e);
    }
    return Optional.ofNullable(value);
  }

  private static CodedInputStream newInput(ByteString bytes) {
    CodedInputStream input = bytes.newCodedInput();
    input.enableAliasing(true);
    return input;
  }

  private static int fieldNumber(int tag) {
    return tag >>> TAG_TYPE_BITS;
  }

  /** One encoded series identifier; labels are parsed on each access. */
  public static class SeriesIdentifierView {
    private static final int LABELS_FIELD_NUMBER =
        org.hypertrace.core.logquery.api.SeriesIdentifier.LABELS_FIELD_NUMBER;

    private final ByteString identifier;

    SeriesIdentifierView(ByteString identifier) {
      this.identifier = identifier;
    }

    public void forEachLabel(BiConsumer<String, String> consumer) {
      CodedInputStream input = newInput(identifier);
      try {
        int tag;
        while ((tag = input.readTag()) != 0) {
          if (fieldNumber(tag) != LABELS_FIELD_NUMBER) {
            input.skipField(tag);
            continue;
          }
          int limit = input.pushLimit(input.readRawVarint32());
          String name = "";
          String value = "";
          int pairTag;
          while ((pairTag = input.readTag()) != 0) {
            switch (fieldNumber(pairTag)) {
              case LabelPair.NAME_FIELD_NUMBER:
                name = input.readStringRequireUtf8();
                break;
              case LabelPair.VALUE_FIELD_NUMBER:
                value = input.readStringRequireUtf8();
                break;
              default:
                input.skipField(pairTag);
            }
          }
          input.popLimit(limit);
          consumer.accept(name, value);
        }
      } catch (IOException e) {
        throw new IllegalStateException("malformed series identifier", e);
      }
    }

    public List<Map.Entry<String, String>> labels() {
      List<Map.Entry<String, String>> labels = new ArrayList<>();
      forEachLabel(
          (name, value) -> labels.add(new AbstractMap.SimpleImmutableEntry<>(name, value)));
      return labels;
    }

    public long hash() {
      return LabelSetHasher.hash(labels());
    }

    /** Raw bytes of the identifier, ready to be written into another series message. */
    public ByteString toByteString() {
      return identifier;
    }

    public SeriesIdentifier materialize() {
      Map<String, String> labels = new LinkedHashMap<>();
      forEachLabel(labels::put);
      return SeriesIdentifier.of(labels);
    }
  }
}
