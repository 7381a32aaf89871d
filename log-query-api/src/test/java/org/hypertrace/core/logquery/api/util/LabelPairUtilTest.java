package org.hypertrace.core.logquery.api.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.logquery.api.LabelPair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LabelPairUtilTest {
  @Test
  public void testFromMapSortsByName() {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("namespace", "loki");
    labels.put("app", "querier");

    Assertions.assertEquals(
        List.of(
            LabelPair.newBuilder().setName("app").setValue("querier").build(),
            LabelPair.newBuilder().setName("namespace").setValue("loki").build()),
        LabelPairUtil.fromMap(labels));
  }

  @Test
  public void testToMapKeepsPairOrder() {
    Map<String, String> labels =
        LabelPairUtil.toMap(
            List.of(
                LabelPairUtil.createLabelPair("z", "1"), LabelPairUtil.createLabelPair("a", "2")));

    Assertions.assertEquals(List.of("z", "a"), List.copyOf(labels.keySet()));
    Assertions.assertEquals("2", labels.get("a"));
  }
}
