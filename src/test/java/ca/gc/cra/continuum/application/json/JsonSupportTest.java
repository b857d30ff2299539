package ca.gc.cra.continuum.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedDocumentPreservingOrder() {
    Map<String, Object> parsed = json.parseObject("{\"b\":1,\"a\":[true,null,\"x\"],\"c\":{\"d\":2.5}}");

    assertEquals(List.of("b", "a", "c"), List.copyOf(parsed.keySet()));
    assertEquals(1, parsed.get("b"));
    assertEquals(Arrays.asList(true, null, "x"), parsed.get("a"));
    assertEquals(Map.of("d", 2.5d), parsed.get("c"));
  }

  @Test
  void rejectsMalformedOrNonObjectDocuments() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("\"text\""));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("{} []"));
  }

  @Test
  void emptyDocumentParsesToMutableEmptyObject() {
    Map<String, Object> parsed = json.parseObject("   ");

    assertTrue(parsed.isEmpty());
    parsed.put("k", 1);
    assertEquals(Map.of(), json.parse(""));
  }

  @Test
  void writesCompactJsonAndNullsNonFiniteNumbers() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("n", 3L);
    value.put("f", Double.NaN);
    value.put("s", "q\"uote");
    value.put("arr", new Object[] {1, false});

    assertEquals("{\"n\":3,\"f\":null,\"s\":\"q\\\"uote\",\"arr\":[1,false]}", json.write(value));
  }

  @Test
  void prettyOutputSpansLines() {
    assertTrue(json.write(Map.of("a", 1), true).contains("\n"));
  }
}
