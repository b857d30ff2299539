package ca.gc.cra.continuum.application.evidence;

import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_AUDIT;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_CACHE_HIT;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_CONFIDENCE;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_CONFIDENCE_CLASSIFIER;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_CONFIDENCE_FINAL;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_INPUT_LENGTH;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_LLM_USED;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_METRICS;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_OUTPUT_LENGTH;
import static ca.gc.cra.continuum.domain.evidence.EvidenceRecord.KEY_USAGE;

import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Structural validator for v1.0 evidence records.
 * <p><strong>Why:</strong> Schema violations are data, not failures; they are stored with the record so consumers
 * can filter incomplete evidence without the request ever failing.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class EvidenceSchema {

  /**
   * Validates an assembled record map.
   *
   * @param record record fields before {@code schema_valid} is attached
   * @return accumulated violation codes in check order; empty when valid
   */
  public List<String> validate(Map<String, Object> record) {
    List<String> errors = new ArrayList<>();
    if (record == null) {
      errors.add("type:record_not_object");
      return errors;
    }
    for (String key : EvidenceRecord.REQUIRED_TOP_KEYS) {
      if (!record.containsKey(key)) {
        errors.add("missing:" + key);
      }
    }

    Object confidence = record.get(KEY_CONFIDENCE);
    if (record.containsKey(KEY_CONFIDENCE)) {
      if (confidence instanceof Map<?, ?> conf) {
        if (!conf.containsKey(KEY_CONFIDENCE_FINAL)) {
          errors.add("missing:confidence.final");
        }
        if (!conf.containsKey(KEY_CONFIDENCE_CLASSIFIER)) {
          errors.add("missing:confidence.classifier");
        }
      } else {
        errors.add("type:confidence_not_object");
      }
    }

    requireInteger(record, KEY_INPUT_LENGTH, errors);
    requireInteger(record, KEY_OUTPUT_LENGTH, errors);
    requireBooleanOrNull(record, KEY_LLM_USED, errors);
    requireBooleanOrNull(record, KEY_CACHE_HIT, errors);
    requireObject(record, KEY_USAGE, errors);
    requireObject(record, KEY_AUDIT, errors);
    requireObject(record, KEY_METRICS, errors);
    return errors;
  }

  private static void requireInteger(Map<String, Object> record, String key, List<String> errors) {
    if (!record.containsKey(key)) {
      return;
    }
    Object value = record.get(key);
    boolean integral = value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte;
    if (!integral) {
      errors.add("type:" + key + "_not_int");
    }
  }

  private static void requireBooleanOrNull(Map<String, Object> record, String key, List<String> errors) {
    if (!record.containsKey(key)) {
      return;
    }
    Object value = record.get(key);
    if (value != null && !(value instanceof Boolean)) {
      errors.add("type:" + key + "_not_bool");
    }
  }

  private static void requireObject(Map<String, Object> record, String key, List<String> errors) {
    if (!record.containsKey(key)) {
      return;
    }
    if (!(record.get(key) instanceof Map<?, ?>)) {
      errors.add("type:" + key + "_not_object");
    }
  }
}
