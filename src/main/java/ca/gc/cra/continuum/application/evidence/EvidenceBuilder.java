package ca.gc.cra.continuum.application.evidence;

import ca.gc.cra.continuum.application.scrub.ContentScrubber;
import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import ca.gc.cra.continuum.domain.evidence.Fingerprint;
import ca.gc.cra.continuum.domain.evidence.Fingerprinter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assembles the v1.0 evidence record for one decision.
 * <p><strong>Why:</strong> The record is the only durable trace of a request, so it is built from fingerprints,
 * engine truth and scrubbed sub-objects only.</p>
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Fingerprint the request text and the output text ({@code ""} when blocked).</li>
 *   <li>Scrub the engine {@code audit} and {@code metrics} objects.</li>
 *   <li>Assemble fields in schema order and validate; violations are attached, never thrown.</li>
 *   <li>Scrub the whole record once more.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class EvidenceBuilder {
  private static final Logger log = LoggerFactory.getLogger(EvidenceBuilder.class);

  private final Fingerprinter fingerprinter;
  private final ContentScrubber scrubber;
  private final EvidenceSchema schema;

  public EvidenceBuilder(Fingerprinter fingerprinter, ContentScrubber scrubber) {
    this(fingerprinter, scrubber, new EvidenceSchema());
  }

  public EvidenceBuilder(Fingerprinter fingerprinter, ContentScrubber scrubber, EvidenceSchema schema) {
    this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
    this.scrubber = Objects.requireNonNull(scrubber, "scrubber");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Builds an evidence record.
   *
   * @param request evidence inputs; must not be {@code null}
   * @return immutable, scrubbed record carrying {@code schema_valid} and, when invalid, {@code schema_errors}
   */
  public EvidenceRecord build(EvidenceRequest request) {
    Objects.requireNonNull(request, "request");
    Fingerprint input = fingerprinter.fingerprint(request.requestText());
    Fingerprint output = fingerprinter.fingerprint(
        request.repairedText() == null ? "" : request.repairedText());

    Map<String, Object> record = new LinkedHashMap<>();
    record.put(EvidenceRecord.KEY_SCHEMA_VERSION, EvidenceRecord.SCHEMA_VERSION);
    record.put(EvidenceRecord.KEY_INPUT_FP, input.sha256Hex());
    record.put(EvidenceRecord.KEY_INPUT_LENGTH, input.length());
    record.put(EvidenceRecord.KEY_OUTPUT_FP, output.sha256Hex());
    record.put(EvidenceRecord.KEY_OUTPUT_LENGTH, output.length());
    record.put(EvidenceRecord.KEY_FREQ_TYPE, request.freqType());
    record.put(EvidenceRecord.KEY_MODE, request.mode());
    record.put(EvidenceRecord.KEY_SCENARIO, request.scenario());
    record.put(EvidenceRecord.KEY_CONFIDENCE, confidence(request));
    record.put(EvidenceRecord.KEY_METRICS, scrubber.scrubMap(request.metrics()));
    record.put(EvidenceRecord.KEY_AUDIT, scrubber.scrubMap(request.audit()));
    record.put(EvidenceRecord.KEY_LLM_USED, request.llmUsed());
    record.put(EvidenceRecord.KEY_CACHE_HIT, request.cacheHit());
    record.put(EvidenceRecord.KEY_MODEL, request.model());
    record.put(EvidenceRecord.KEY_USAGE, request.usage());
    record.put(EvidenceRecord.KEY_OUTPUT_SOURCE, request.outputSource());
    record.put(EvidenceRecord.KEY_API_VERSION, EvidenceRecord.API_VERSION);
    record.put(EvidenceRecord.KEY_PIPELINE_FINGERPRINT, request.pipelineFingerprint());

    // Validate what will be persisted: scrubbing can drop an oversized top-level field.
    Map<String, Object> scrubbed = scrubber.scrubMap(record);
    List<String> errors = schema.validate(scrubbed);
    scrubbed.put(EvidenceRecord.KEY_SCHEMA_VALID, errors.isEmpty());
    if (!errors.isEmpty()) {
      scrubbed.put(EvidenceRecord.KEY_SCHEMA_ERRORS, List.copyOf(errors));
      log.warn("Evidence record failed schema checks: {}", errors);
    }

    return new EvidenceRecord(scrubber.scrubMap(scrubbed));
  }

  private static Map<String, Object> confidence(EvidenceRequest request) {
    Map<String, Object> confidence = new LinkedHashMap<>();
    if (request.confidenceFinal() != null) {
      confidence.put(EvidenceRecord.KEY_CONFIDENCE_FINAL, request.confidenceFinal());
    }
    if (request.confidenceClassifier() != null) {
      confidence.put(EvidenceRecord.KEY_CONFIDENCE_CLASSIFIER, request.confidenceClassifier());
    }
    return confidence;
  }
}
