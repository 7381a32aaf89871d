package org.hypertrace.core.logquery.response;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.grpc.Status;
import io.grpc.StatusException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.logquery.ApiVersion;
import org.hypertrace.core.logquery.api.QueryResponse;
import org.hypertrace.core.logquery.api.SeriesResponse;
import org.hypertrace.core.logquery.api.util.LabelPairUtil;
import org.hypertrace.core.logquery.codec.ProtobufResponseConverter;
import org.junit.jupiter.api.Test;

class SeriesQueryResponseViewTest {

  @Test
  void readsSeriesWithoutMaterializing() throws StatusException {
    SeriesQueryResponse series =
        SeriesQueryResponse.builder()
            .version(ApiVersion.LEGACY)
            .series(SeriesIdentifier.of(Map.of("app", "foo")))
            .series(SeriesIdentifier.of(Map.of("app", "bar")))
            .statistics(
                QueryStatistics.builder()
                    .summary(QueryStatistics.Summary.builder().shards(3).build())
                    .build())
            .build();
    List<QueryResponseHeader> headers = List.of(new QueryResponseHeader("X-Shard", List.of("1")));

    SeriesQueryResponseView view =
        SeriesQueryResponseView.of(ProtobufResponseConverter.encode(series), headers);

    assertEquals(LogQueryResponse.STATUS_SUCCESS, view.getStatus());
    assertEquals(ApiVersion.LEGACY.getValue(), view.getVersion());
    assertEquals(3, view.getStatistics().getSummary().getShards());
    assertEquals(headers, view.getHeaders());
    List<String> values = new ArrayList<>();
    for (SeriesQueryResponseView.SeriesIdentifierView identifier : view) {
      identifier.forEachLabel((name, value) -> values.add(name + "=" + value));
    }
    assertEquals(List.of("app=foo", "app=bar"), values);
    assertEquals(series.withHeaders(headers), view.materialize());
  }

  @Test
  void hashesLikeMaterializedIdentifiers() throws StatusException {
    SeriesIdentifier identifier = SeriesIdentifier.of(Map.of("app", "foo", "env", "prod"));
    SeriesQueryResponseView view =
        SeriesQueryResponseView.of(
            ProtobufResponseConverter.encode(
                SeriesQueryResponse.builder().series(identifier).build()),
            List.of());

    SeriesQueryResponseView.SeriesIdentifierView first = view.iterator().next();

    assertEquals(identifier.hash(), first.hash());
    assertEquals(2, first.labels().size());
  }

  @Test
  void keepsLabelOrderOfTheWire() throws StatusException {
    byte[] envelope =
        QueryResponse.newBuilder()
            .setSeries(
                SeriesResponse.newBuilder()
                    .setStatus("success")
                    .addData(
                        org.hypertrace.core.logquery.api.SeriesIdentifier.newBuilder()
                            .addLabels(LabelPairUtil.createLabelPair("z", "1"))
                            .addLabels(LabelPairUtil.createLabelPair("a", "2"))))
            .build()
            .toByteArray();

    SeriesQueryResponseView view = SeriesQueryResponseView.of(envelope, List.of());

    assertEquals(
        List.of(
            new AbstractMap.SimpleImmutableEntry<>("z", "1"),
            new AbstractMap.SimpleImmutableEntry<>("a", "2")),
        view.iterator().next().labels());
  }

  @Test
  void mergedViewsDeduplicateOnEveryIteration() throws StatusException {
    SeriesQueryResponseView first = view(Map.of("a", "1"), Map.of("b", "2"));
    SeriesQueryResponseView second = view(Map.of("b", "2"), Map.of("c", "3"));

    MergedSeriesQueryResponseView merged =
        new MergedSeriesQueryResponseView(List.of(first, second), List.of());

    int firstPass = 0;
    for (SeriesQueryResponseView.SeriesIdentifierView ignored : merged.uniqueSeries()) {
      firstPass++;
    }
    int secondPass = 0;
    for (SeriesQueryResponseView.SeriesIdentifierView ignored : merged.uniqueSeries()) {
      secondPass++;
    }
    assertEquals(3, firstPass);
    assertEquals(3, secondPass);
  }

  @Test
  void rejectsEnvelopesWithoutSeries() throws StatusException {
    byte[] labels =
        ProtobufResponseConverter.encode(LabelNamesQueryResponse.builder().name("app").build());

    StatusException exception =
        assertThrows(StatusException.class, () -> SeriesQueryResponseView.of(labels, List.of()));
    assertEquals(Status.Code.INTERNAL, exception.getStatus().getCode());
  }

  @SafeVarargs
  private static SeriesQueryResponseView view(Map<String, String>... labels)
      throws StatusException {
    SeriesQueryResponse.SeriesQueryResponseBuilder builder = SeriesQueryResponse.builder();
    for (Map<String, String> series : labels) {
      builder.series(SeriesIdentifier.of(series));
    }
    return SeriesQueryResponseView.of(ProtobufResponseConverter.encode(builder.build()), List.of());
  }
}
