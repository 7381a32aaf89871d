package org.hypertrace.core.logquery.labels;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LabelSetsTest {

  @Test
  void formatsNamesInAscendingOrder() {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("env", "prod");
    labels.put("app", "foo");

    assertEquals("{app=\"foo\", env=\"prod\"}", LabelSets.format(labels));
    assertEquals(LabelSets.EMPTY, LabelSets.format(Map.of()));
  }

  @Test
  void escapesValues() {
    String formatted = LabelSets.format(Map.of("msg", "say \"hi\"\n\\"));

    assertEquals("{msg=\"say \\\"hi\\\"\\n\\\\\"}", formatted);
    assertEquals(Map.of("msg", "say \"hi\"\n\\"), LabelSets.parse(formatted));
  }

  @Test
  void parsesLabelsInTheirOrder() {
    Map<String, String> labels = LabelSets.parse("{ z=\"1\",a = \"2\" , m=\"\"}");

    assertEquals(List.of("z", "a", "m"), List.copyOf(labels.keySet()));
    assertEquals("", labels.get("m"));
    assertEquals(Map.of(), LabelSets.parse("{}"));
  }

  @Test
  void rejectsMalformedLabelSets() {
    assertThrows(IllegalArgumentException.class, () -> LabelSets.parse("app=\"foo\""));
    assertThrows(IllegalArgumentException.class, () -> LabelSets.parse("{app}"));
    assertThrows(IllegalArgumentException.class, () -> LabelSets.parse("{app=foo}"));
    assertThrows(IllegalArgumentException.class, () -> LabelSets.parse("{app=\"foo}"));
  }

  @Test
  void hashIgnoresLabelOrder() {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("env", "prod");
    labels.put("app", "foo");

    assertEquals(
        LabelSetHasher.hash(Map.of("app", "foo", "env", "prod")), LabelSetHasher.hash(labels));
    assertEquals(
        LabelSetHasher.hash(labels),
        LabelSetHasher.hash(
            List.of(
                new AbstractMap.SimpleImmutableEntry<>("app", "foo"),
                new AbstractMap.SimpleImmutableEntry<>("env", "prod"))));
    assertNotEquals(
        LabelSetHasher.hash(Map.of("a", "bc")), LabelSetHasher.hash(Map.of("ab", "c")));
  }
}
