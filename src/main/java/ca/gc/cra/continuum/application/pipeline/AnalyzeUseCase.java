package ca.gc.cra.continuum.application.pipeline;

import ca.gc.cra.continuum.application.decision.DecisionNormalizer;
import ca.gc.cra.continuum.application.decision.DecisionOutcome;
import ca.gc.cra.continuum.application.evidence.EvidenceBuilder;
import ca.gc.cra.continuum.application.evidence.EvidenceRequest;
import ca.gc.cra.continuum.application.license.LicenseGate;
import ca.gc.cra.continuum.application.metrics.MetricsAggregator;
import ca.gc.cra.continuum.application.port.ClockPort;
import ca.gc.cra.continuum.application.port.DecisionEngineException;
import ca.gc.cra.continuum.application.port.DecisionEnginePort;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.application.store.WriteReceipt;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ca.gc.cra.continuum.domain.evidence.AnalysisEvent;
import ca.gc.cra.continuum.domain.evidence.EventId;
import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import ca.gc.cra.continuum.domain.evidence.Fingerprinter;
import ca.gc.cra.continuum.logging.Logs;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one request through license admission, the Decision Engine, decision normalization,
 * evidence assembly, best-effort remote write and metrics.
 * <p><strong>Flow:</strong> validate input, admit, evaluate, resolve decision, build evidence, shape the response,
 * write the event, record metrics.</p>
 * <p><strong>Failure semantics:</strong>
 * <ul>
 *   <li>Invalid input or an engine error verdict raises {@link InvalidRequestException}; nothing is written.</li>
 *   <li>A missing engine raises {@link ServiceUnavailableException}.</li>
 *   <li>License rejection in stop mode raises {@code LicensePolicyException} before the engine is called.</li>
 *   <li>Remote write failures never fail the request; they show up in the {@link WriteReceipt}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent requests.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);

  /** Input length limit used when none is configured. */
  public static final int DEFAULT_MAX_INPUT_LENGTH = 1000;
  /** Confidence below which the response carries a low-confidence note. */
  public static final double LOW_CONFIDENCE = 0.3d;

  static final String SAFETY_NOTE =
      "Safety gate triggered. Downstream system should follow crisis/safety policy.";
  static final String UNKNOWN_NOTE =
      "Unable to detect specific tone pattern. The text appears neutral or requires more context.";

  private final DecisionEnginePort engine;
  private final LicenseGate licenseGate;
  private final DecisionNormalizer normalizer;
  private final EvidenceBuilder evidenceBuilder;
  private final Fingerprinter fingerprinter;
  private final RemoteEventWriter writer;
  private final MetricsAggregator metrics;
  private final ClockPort clock;
  private final int maxInputLength;

  /**
   * Creates the use case.
   *
   * @param engine Decision Engine; {@code null} when not configured (only replay is then possible)
   * @param licenseGate request admission
   * @param normalizer decision normalizer
   * @param evidenceBuilder evidence builder
   * @param fingerprinter fingerprinter for the event input section
   * @param writer remote event writer
   * @param metrics in-process metrics
   * @param clock time source
   * @param maxInputLength maximum request length in characters
   */
  public AnalyzeUseCase(
      DecisionEnginePort engine,
      LicenseGate licenseGate,
      DecisionNormalizer normalizer,
      EvidenceBuilder evidenceBuilder,
      Fingerprinter fingerprinter,
      RemoteEventWriter writer,
      MetricsAggregator metrics,
      ClockPort clock,
      int maxInputLength) {
    this.engine = engine;
    this.licenseGate = Objects.requireNonNull(licenseGate, "licenseGate");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.evidenceBuilder = Objects.requireNonNull(evidenceBuilder, "evidenceBuilder");
    this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxInputLength <= 0) {
      throw new IllegalArgumentException("maxInputLength must be positive");
    }
    this.maxInputLength = maxInputLength;
  }

  /**
   * Analyzes request text through the configured Decision Engine.
   *
   * @param text request text
   * @return caller-facing result
   * @throws DecisionEngineException when the engine cannot be reached or answers unreadably
   */
  public AnalyzeResult analyze(String text) throws DecisionEngineException {
    validateInput(text);
    if (engine == null) {
      throw new ServiceUnavailableException("Decision engine not ready");
    }
    licenseGate.admit();
    long startNanos = System.nanoTime();
    Verdict verdict = engine.evaluate(text);
    return complete(text, verdict, startNanos);
  }

  /**
   * Records a verdict that was obtained elsewhere, for example when replaying captured decisions.
   *
   * @param text request text the verdict belongs to
   * @param verdict engine verdict
   * @return caller-facing result
   */
  public AnalyzeResult record(String text, Verdict verdict) {
    validateInput(text);
    Objects.requireNonNull(verdict, "verdict");
    licenseGate.admit();
    return complete(text, verdict, System.nanoTime());
  }

  public boolean engineReady() {
    return engine != null;
  }

  private void validateInput(String text) {
    if (text == null || text.isEmpty()) {
      throw new InvalidRequestException("text must not be empty");
    }
    if (text.length() > maxInputLength) {
      throw new InvalidRequestException(
          "text must be at most " + maxInputLength + " characters (was " + text.length() + ")");
    }
  }

  private AnalyzeResult complete(String text, Verdict verdict, long startNanos) {
    if (verdict.failed()) {
      String reason = verdict.reason() == null || verdict.reason().isBlank() ? verdict.error() : verdict.reason();
      log.info("Decision engine refused request ({}): {}", Logs.describe(text), verdict.error());
      throw new InvalidRequestException(reason);
    }

    DecisionOutcome outcome = normalizer.resolve(verdict);
    EvidenceRecord evidence = evidenceBuilder.build(EvidenceRequest.from(text, verdict));

    String repairedText = verdict.repairedText();
    String repairNote = null;
    double confidence = verdict.confidenceOrZero();
    boolean safety = verdict.safetyTriggered();
    if (safety) {
      repairedText = text;
      repairNote = SAFETY_NOTE;
    } else if ("Unknown".equals(verdict.freqType())) {
      repairedText = text;
      repairNote = UNKNOWN_NOTE;
    } else if (confidence < LOW_CONFIDENCE) {
      repairedText = text;
      repairNote = String.format(
          Locale.ROOT,
          "Low confidence detection (%.2f). Suggested tone: %s. Please review manually.",
          confidence,
          verdict.freqType());
    }

    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    Instant now = clock.now();
    String id = EventId.newId(now.toEpochMilli());

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("decision_state", outcome.state().name());
    metadata.put("freq_type", verdict.freqType());
    metadata.put("mode", verdict.mode());
    metadata.put("confidence", confidence);
    metadata.put("safety_flag", verdict.safetyFlag());
    metadata.put("text_length", text.length());
    metadata.put("latency_ms", latencyMs);

    AnalysisEvent event = new AnalysisEvent(
        id, now, fingerprinter.fingerprint(text), fingerprinter.salted(), evidence, metadata);
    WriteReceipt receipt = writer.writeAnalysis(event);

    metrics.record(
        outcome.state(),
        latencyMs,
        Boolean.TRUE.equals(verdict.llmUsed()),
        DecisionNormalizer.OUT_OF_SCOPE.equals(verdict.freqType()));

    log.info(
        "Analysis {} decided {} ({}, latency={}ms, schema_valid={}, write={})",
        id,
        outcome.state(),
        Logs.describe(text),
        latencyMs,
        evidence.schemaValid(),
        receipt.status());

    return new AnalyzeResult(
        id,
        verdict.freqType(),
        confidence,
        verdict.scenario() == null ? "unknown" : verdict.scenario(),
        verdict.mode(),
        outcome.state(),
        repairedText,
        repairNote,
        verdict.safetyFlag(),
        verdict.safetyConfidence(),
        latencyMs,
        evidence,
        receipt);
  }
}
