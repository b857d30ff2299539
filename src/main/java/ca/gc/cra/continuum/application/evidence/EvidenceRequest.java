package ca.gc.cra.continuum.application.evidence;

import ca.gc.cra.continuum.domain.decision.Verdict;
import java.util.Map;

/**
 * Inputs for one evidence record.
 *
 * @param requestText request text; fingerprinted, never stored
 * @param repairedText output text; {@code null} when blocked
 * @param freqType engine classification label
 * @param mode engine mode
 * @param scenario output scenario
 * @param confidenceFinal final confidence; {@code null} is reported missing
 * @param confidenceClassifier classifier confidence; {@code null} is reported missing
 * @param metrics engine metrics object, unscrubbed
 * @param audit engine audit object, unscrubbed
 * @param llmUsed whether a language model was used
 * @param cacheHit whether the engine answered from cache
 * @param model model identifier
 * @param usage token usage object
 * @param outputSource origin of the output text
 * @param pipelineFingerprint engine pipeline version fingerprint
 * @since 0.1.0
 */
public record EvidenceRequest(
    String requestText,
    String repairedText,
    String freqType,
    String mode,
    String scenario,
    Double confidenceFinal,
    Double confidenceClassifier,
    Map<String, Object> metrics,
    Map<String, Object> audit,
    Boolean llmUsed,
    Boolean cacheHit,
    String model,
    Map<String, Object> usage,
    String outputSource,
    String pipelineFingerprint) {

  /**
   * Derives the evidence inputs for a request from its engine verdict.
   *
   * @param requestText request text
   * @param verdict engine verdict
   * @return evidence inputs
   */
  public static EvidenceRequest from(String requestText, Verdict verdict) {
    return new EvidenceRequest(
        requestText,
        verdict.repairedText(),
        verdict.freqType(),
        verdict.mode(),
        verdict.scenario(),
        verdict.confidenceFinal(),
        verdict.confidenceClassifier(),
        verdict.metrics(),
        verdict.audit(),
        verdict.llmUsed(),
        verdict.cacheHit(),
        verdict.model(),
        verdict.usage(),
        verdict.outputSource(),
        verdict.pipelineFingerprint());
  }

  @Override
  public String toString() {
    return "EvidenceRequest[freqType=" + freqType + ", mode=" + mode + ", scenario=" + scenario + "]";
  }
}
