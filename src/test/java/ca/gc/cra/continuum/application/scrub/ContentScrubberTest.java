package ca.gc.cra.continuum.application.scrub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContentScrubberTest {
  private final ContentScrubber scrubber = new ContentScrubber();

  @Test
  void dropsRawTextKeysAtAnyDepth() {
    Map<String, Object> audit = new LinkedHashMap<>();
    audit.put("text", "hello there");
    audit.put("rule_count", 3);
    audit.put("stage", Map.of("prompt", "secret", "latency", 12));

    Map<String, Object> scrubbed = scrubber.scrubMap(audit);

    assertEquals(Map.of("rule_count", 3, "stage", Map.of("latency", 12)), scrubbed);
  }

  @Test
  void keyVariantsAreNormalizedBeforeMatching() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("repairedText", "x");
    input.put("Input-Text", "x");
    input.put("raw.ai.output", "x");
    input.put("LLMRawOutput", "x");
    input.put("kept", 1);

    assertEquals(Map.of("kept", 1), scrubber.scrubMap(input));
  }

  @Test
  void dropsContentDerivedKeysAndPrefixes() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("lexicon_hits", List.of("a", "b"));
    input.put("matched_terms", List.of("a"));
    input.put("trigger_words", "x");
    input.put("detected_phrases", 2);
    input.put("hit_count", 2);

    assertEquals(Map.of("hit_count", 2), scrubber.scrubMap(input));
  }

  @Test
  void signalledKeysSurviveOnlyWhileSmall() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("output_note", "short");
    input.put("user_message", "x".repeat(601));
    input.put("trace_id", "y".repeat(601));

    Map<String, Object> scrubbed = scrubber.scrubMap(input);

    assertEquals("short", scrubbed.get("output_note"));
    assertFalse(scrubbed.containsKey("user_message"));
    assertEquals(601, ((String) scrubbed.get("trace_id")).length(), "no signal, so long values stay");
  }

  @Test
  void capsListsAndMaps() {
    List<Integer> longList = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      longList.add(i);
    }
    Map<String, Object> wide = new LinkedHashMap<>();
    for (int i = 0; i < 150; i++) {
      wide.put("k" + i, i);
    }

    Map<String, Object> scrubbed = scrubber.scrubMap(Map.of("ids", longList, "wide", wide));

    assertEquals(80, ((List<?>) scrubbed.get("ids")).size());
    Map<?, ?> keptWide = (Map<?, ?>) scrubbed.get("wide");
    assertEquals(120, keptWide.size());
    assertTrue(keptWide.containsKey("k0"));
    assertFalse(keptWide.containsKey("k120"));
  }

  @Test
  void deepNestingIsReplacedByMarker() {
    Object nested = "leaf";
    for (int i = 0; i < 40; i++) {
      nested = Map.of("n", nested);
    }

    Object scrubbed = scrubber.scrub(nested);

    Object cursor = scrubbed;
    int depth = 0;
    while (cursor instanceof Map<?, ?> map) {
      cursor = map.get("n");
      depth++;
    }
    assertEquals(ScrubRules.DEPTH_MARKER, cursor);
    assertEquals(33, depth);
  }

  @Test
  void scrubbingIsIdempotent() {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("completion", "drop me");
    input.put("nested", List.of(Map.of("content", "x", "score", 0.4), new Object[] {"a", 1}));
    input.put("count", 7);

    Object once = scrubber.scrub(input);

    assertEquals(once, scrubber.scrub(once));
    assertEquals(List.of(Map.of("score", 0.4), List.of("a", 1)), ((Map<?, ?>) once).get("nested"));
  }

  @Test
  void scalarsAndNullPassThrough() {
    assertEquals(42, scrubber.scrub(42));
    assertEquals(null, scrubber.scrub(null));
    assertEquals(Map.of(), scrubber.scrubMap(null));
  }

  @Test
  void selfReferencesBecomeMarkers() {
    List<Object> loop = new ArrayList<>();
    loop.add(loop);
    loop.add(loop);
    loop.add(loop);
    loop.add(7);
    Map<String, Object> self = new LinkedHashMap<>();
    self.put("self", self);
    self.put("items", loop);
    self.put("n", 1);

    Map<String, Object> scrubbed = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> scrubber.scrubMap(self));

    assertEquals(ScrubRules.DEPTH_MARKER, scrubbed.get("self"));
    assertEquals(
        List.of(ScrubRules.DEPTH_MARKER, ScrubRules.DEPTH_MARKER, ScrubRules.DEPTH_MARKER, 7), scrubbed.get("items"));
    assertEquals(1, scrubbed.get("n"));
    assertEquals(List.of(ScrubRules.DEPTH_MARKER, ScrubRules.DEPTH_MARKER, ScrubRules.DEPTH_MARKER, 7),
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> scrubber.scrub(loop)));
  }

  @Test
  void sharedSubtreesAreNotMistakenForCycles() {
    Map<String, Object> shared = Map.of("latency", 4);
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("first", shared);
    input.put("second", List.of(shared, shared));

    Map<String, Object> scrubbed = scrubber.scrubMap(input);

    assertEquals(Map.of("first", shared, "second", List.of(shared, shared)), scrubbed);
  }
}
