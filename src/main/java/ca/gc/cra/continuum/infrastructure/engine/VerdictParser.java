package ca.gc.cra.continuum.infrastructure.engine;

import ca.gc.cra.continuum.domain.decision.Verdict;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a Decision Engine JSON object onto a {@link Verdict}.
 *
 * <p>Expected layout: {@code freq_type, mode, output{scenario, repaired_text, source}, confidence{final,
 * classifier}, llm_used, cache_hit, model, usage, audit, metrics, pipeline_version_fingerprint, error, reason,
 * safety{flag, confidence}}. Fields of the wrong type are treated as absent; a bare number under
 * {@code confidence} is taken as the final confidence.</p>
 *
 * @since 0.1.0
 */
public final class VerdictParser {

  private VerdictParser() {}

  /**
   * Parses a verdict object.
   *
   * @param doc parsed engine answer
   * @return verdict
   * @throws IllegalArgumentException when {@code doc} is {@code null}
   */
  public static Verdict parse(Map<?, ?> doc) {
    if (doc == null) {
      throw new IllegalArgumentException("verdict must be a JSON object");
    }
    return parseObject(copyOf(doc));
  }

  private static Map<String, Object> copyOf(Map<?, ?> map) {
    Map<String, Object> out = new LinkedHashMap<>();
    map.forEach((k, v) -> out.put(String.valueOf(k), v));
    return out;
  }

  private static Verdict parseObject(Map<String, Object> doc) {
    Map<String, Object> output = object(doc.get("output"));
    Map<String, Object> safety = object(doc.get("safety"));

    Verdict.Builder builder = Verdict.builder()
        .freqType(string(doc.get("freq_type")))
        .mode(string(doc.get("mode")))
        .scenario(string(output.get("scenario")))
        .repairedText(string(output.get("repaired_text")))
        .llmUsed(bool(doc.get("llm_used")))
        .cacheHit(bool(doc.get("cache_hit")))
        .model(string(doc.get("model")))
        .usage(object(doc.get("usage")))
        .audit(object(doc.get("audit")))
        .metrics(object(doc.get("metrics")))
        .pipelineFingerprint(string(doc.get("pipeline_version_fingerprint")))
        .outputSource(firstString(doc.get("output_source"), output.get("source")))
        .error(string(doc.get("error")), string(doc.get("reason")))
        .safety(string(safety.get("flag")), number(safety.get("confidence")));

    Object confidence = doc.get("confidence");
    if (confidence instanceof Map<?, ?>) {
      Map<String, Object> values = object(confidence);
      builder.confidence(number(values.get("final")), number(values.get("classifier")));
    } else {
      builder.confidence(number(confidence), null);
    }
    return builder.build();
  }

  private static Map<String, Object> object(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copyOf(map);
    }
    return Map.of();
  }

  private static String string(Object value) {
    return value instanceof String s ? s : null;
  }

  private static String firstString(Object first, Object second) {
    String value = string(first);
    return value != null ? value : string(second);
  }

  private static Boolean bool(Object value) {
    return value instanceof Boolean b ? b : null;
  }

  private static Double number(Object value) {
    return value instanceof Number n ? n.doubleValue() : null;
  }
}
