package ca.gc.cra.continuum.domain.decision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Decision Engine output for one request, as consumed by the audit pipeline.
 * <p><strong>Why:</strong> The engine is the single source of truth for classification; this value carries its
 * answer across the port boundary without interpretation.</p>
 * <p><strong>Role:</strong> Input to the decision normalizer, the evidence builder and response shaping.</p>
 * <p><strong>Thread-safety:</strong> Immutable; nested maps are copied and wrapped unmodifiable. Nested maps are
 * unscrubbed and may still contain content until the evidence builder scrubs them.</p>
 *
 * @param freqType engine classification label (for example {@code OutOfScope} or {@code Unknown})
 * @param mode engine mode such as {@code no-op}, {@code block} or {@code guide}
 * @param scenario output scenario label
 * @param repairedText engine output text; {@code null} when the request was blocked
 * @param confidenceFinal final confidence; {@code null} when the engine omitted it
 * @param confidenceClassifier classifier confidence; {@code null} when the engine omitted it
 * @param llmUsed whether a language model was consulted; may be {@code null}
 * @param cacheHit whether the engine served from cache; may be {@code null}
 * @param model model identifier; may be {@code null}
 * @param usage token usage object
 * @param audit engine audit object (unscrubbed)
 * @param metrics engine metrics object (unscrubbed); may assert {@code decision_state}
 * @param pipelineFingerprint engine pipeline version fingerprint
 * @param outputSource origin of the output text
 * @param error engine error code; {@code null} on success
 * @param reason human-readable reason accompanying {@code error}
 * @param safetyFlag safety gate flag; {@code null} or {@code none} when not triggered
 * @param safetyConfidence safety gate confidence; may be {@code null}
 * @since 0.1.0
 */
public record Verdict(
    String freqType,
    String mode,
    String scenario,
    String repairedText,
    Double confidenceFinal,
    Double confidenceClassifier,
    Boolean llmUsed,
    Boolean cacheHit,
    String model,
    Map<String, Object> usage,
    Map<String, Object> audit,
    Map<String, Object> metrics,
    String pipelineFingerprint,
    String outputSource,
    String error,
    String reason,
    String safetyFlag,
    Double safetyConfidence) {

  /** Metrics key under which the engine may assert its own decision state. */
  public static final String ASSERTED_STATE_KEY = "decision_state";

  /** Safety flag value meaning the gate did not trigger. */
  public static final String SAFETY_NONE = "none";

  /**
   * Copies nested maps.
   */
  public Verdict {
    usage = copy(usage);
    audit = copy(audit);
    metrics = copy(metrics);
  }

  /**
   * Indicates whether the engine reported an error instead of a verdict.
   *
   * @return {@code true} when {@code error} is non-blank
   */
  public boolean failed() {
    return error != null && !error.isBlank();
  }

  /**
   * Indicates whether the safety gate triggered.
   *
   * @return {@code true} when the flag is present and not {@code none}
   */
  public boolean safetyTriggered() {
    return safetyFlag != null && !safetyFlag.isBlank() && !SAFETY_NONE.equalsIgnoreCase(safetyFlag.trim());
  }

  /**
   * Returns the state asserted by the engine in its metrics, if any.
   *
   * @return raw asserted value or {@code null}
   */
  public String assertedDecisionState() {
    Object raw = metrics.get(ASSERTED_STATE_KEY);
    return raw == null ? null : raw.toString();
  }

  /**
   * Final confidence or zero when the engine omitted it.
   *
   * @return confidence used for response shaping
   */
  public double confidenceOrZero() {
    return confidenceFinal == null ? 0.0d : confidenceFinal;
  }

  /**
   * Starts a builder with every field unset.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private static Map<String, Object> copy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Mutable builder used by engine adapters and tests.
   */
  public static final class Builder {
    private String freqType;
    private String mode;
    private String scenario;
    private String repairedText;
    private Double confidenceFinal;
    private Double confidenceClassifier;
    private Boolean llmUsed;
    private Boolean cacheHit;
    private String model;
    private Map<String, Object> usage;
    private Map<String, Object> audit;
    private Map<String, Object> metrics;
    private String pipelineFingerprint;
    private String outputSource;
    private String error;
    private String reason;
    private String safetyFlag;
    private Double safetyConfidence;

    private Builder() {}

    public Builder freqType(String value) {
      this.freqType = value;
      return this;
    }

    public Builder mode(String value) {
      this.mode = value;
      return this;
    }

    public Builder scenario(String value) {
      this.scenario = value;
      return this;
    }

    public Builder repairedText(String value) {
      this.repairedText = value;
      return this;
    }

    public Builder confidence(Double finalValue, Double classifierValue) {
      this.confidenceFinal = finalValue;
      this.confidenceClassifier = classifierValue;
      return this;
    }

    public Builder llmUsed(Boolean value) {
      this.llmUsed = value;
      return this;
    }

    public Builder cacheHit(Boolean value) {
      this.cacheHit = value;
      return this;
    }

    public Builder model(String value) {
      this.model = value;
      return this;
    }

    public Builder usage(Map<String, Object> value) {
      this.usage = value;
      return this;
    }

    public Builder audit(Map<String, Object> value) {
      this.audit = value;
      return this;
    }

    public Builder metrics(Map<String, Object> value) {
      this.metrics = value;
      return this;
    }

    public Builder pipelineFingerprint(String value) {
      this.pipelineFingerprint = value;
      return this;
    }

    public Builder outputSource(String value) {
      this.outputSource = value;
      return this;
    }

    public Builder error(String code, String why) {
      this.error = code;
      this.reason = why;
      return this;
    }

    public Builder safety(String flag, Double confidence) {
      this.safetyFlag = flag;
      this.safetyConfidence = confidence;
      return this;
    }

    /**
     * Builds the verdict.
     *
     * @return immutable verdict
     */
    public Verdict build() {
      return new Verdict(
          freqType,
          mode,
          scenario,
          repairedText,
          confidenceFinal,
          confidenceClassifier,
          llmUsed,
          cacheHit,
          model,
          usage,
          audit,
          metrics,
          pipelineFingerprint,
          outputSource,
          error,
          reason,
          safetyFlag,
          safetyConfidence);
    }
  }

  @Override
  public String toString() {
    // Nested maps may still carry content before scrubbing.
    return "Verdict[freqType=" + freqType
        + ", mode=" + mode
        + ", scenario=" + scenario
        + ", error=" + Objects.toString(error, "-")
        + "]";
  }
}
