package ca.gc.cra.continuum.application.scrub;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScrubRulesTest {
  private final ScrubRules rules = ScrubRules.defaults();

  @Test
  void normalizesCamelCaseAndSeparators() {
    assertEquals("repaired_text", ScrubRules.normalizeKey("repairedText"));
    assertEquals("llm_raw_output", ScrubRules.normalizeKey("LLMRawOutput"));
    assertEquals("raw_ai_output", ScrubRules.normalizeKey("raw-ai.output"));
    assertEquals("input_text", ScrubRules.normalizeKey("input text"));
  }

  @Test
  void exactAndPrefixMatches() {
    assertTrue(rules.alwaysDrop("messages"));
    assertTrue(rules.alwaysDrop("responseText"));
    assertTrue(rules.alwaysDrop("keywordsFound"));
    assertFalse(rules.alwaysDrop("latency_ms"));
  }

  @Test
  void substringSignalsIgnoreSeparators() {
    assertTrue(rules.hasSubstringSignal("userUtterance"));
    assertTrue(rules.hasSubstringSignal("out-put"));
    assertFalse(rules.hasSubstringSignal("score"));
  }

  @Test
  void oversizedAppliesPerValueKind() {
    assertTrue(rules.oversized("x".repeat(601)));
    assertFalse(rules.oversized("x".repeat(600)));
    assertTrue(rules.oversized(new Object[81]));
    assertFalse(rules.oversized(12345));
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThrows(IllegalArgumentException.class,
        () -> new ScrubRules(List.of(), List.of(), List.of(), List.of(), 0, 1, 1, 1));
  }
}
