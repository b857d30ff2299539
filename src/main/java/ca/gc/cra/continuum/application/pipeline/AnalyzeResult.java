package ca.gc.cra.continuum.application.pipeline;

import ca.gc.cra.continuum.application.store.WriteReceipt;
import ca.gc.cra.continuum.domain.decision.DecisionState;
import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one analysis as returned to the caller.
 *
 * <p>{@code repairedText} may echo the request text; this value is returned to the caller only and is never
 * persisted. The persisted counterpart is {@code evidence}.</p>
 *
 * @param logId opaque analysis id
 * @param freqType engine classification
 * @param confidence final confidence (zero when the engine omitted it)
 * @param scenario output scenario, {@code unknown} when absent
 * @param mode engine mode
 * @param decisionState authoritative decision state
 * @param repairedText response text after shaping
 * @param repairNote note explaining response shaping; {@code null} when none applied
 * @param safetyFlag safety gate flag
 * @param safetyConfidence safety gate confidence
 * @param latencyMs analysis latency in milliseconds
 * @param evidence evidence record written with the event
 * @param writeReceipt outcome of the remote write
 * @since 0.1.0
 */
public record AnalyzeResult(
    String logId,
    String freqType,
    double confidence,
    String scenario,
    String mode,
    DecisionState decisionState,
    String repairedText,
    String repairNote,
    String safetyFlag,
    Double safetyConfidence,
    long latencyMs,
    EvidenceRecord evidence,
    WriteReceipt writeReceipt) {

  /**
   * Renders the caller-facing response.
   *
   * @return ordered snake_case map
   */
  public Map<String, Object> toResponseMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("freq_type", freqType);
    map.put("confidence", confidence);
    map.put("scenario", scenario);
    map.put("mode", mode);
    map.put("decision_state", decisionState.name());
    map.put("repaired_text", repairedText);
    map.put("repair_note", repairNote);
    map.put("log_id", logId);
    map.put("safety_flag", safetyFlag);
    map.put("safety_confidence", safetyConfidence);
    map.put("write_status", writeReceipt.status().name().toLowerCase(Locale.ROOT));
    return map;
  }

  @Override
  public String toString() {
    return "AnalyzeResult[logId=" + logId + ", decisionState=" + decisionState
        + ", write=" + writeReceipt.status() + "]";
  }
}
