package ca.gc.cra.continuum.domain.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Content-free, schema-versioned summary of one decision (schema v1.0).
 * <p><strong>Why:</strong> Safe to persist indefinitely; every field is either Decision Engine truth, a
 * fingerprint, or a scrubbed sub-object.</p>
 * <p><strong>Role:</strong> Domain value produced by the evidence builder and embedded in {@link AnalysisEvent}.</p>
 * <p><strong>Thread-safety:</strong> Deeply unmodifiable once constructed.</p>
 *
 * @implNote The record is kept in its wire form (an ordered map) so schema checks see exactly what gets written.
 * @since 0.1.0
 */
public final class EvidenceRecord {
  /** Evidence schema version written into every record. */
  public static final String SCHEMA_VERSION = "1.0";
  /** API version stamped into every record. */
  public static final String API_VERSION = "2.0.0";

  public static final String KEY_SCHEMA_VERSION = "schema_version";
  public static final String KEY_INPUT_FP = "input_fp_sha256";
  public static final String KEY_INPUT_LENGTH = "input_length";
  public static final String KEY_OUTPUT_FP = "output_fp_sha256";
  public static final String KEY_OUTPUT_LENGTH = "output_length";
  public static final String KEY_FREQ_TYPE = "freq_type";
  public static final String KEY_MODE = "mode";
  public static final String KEY_SCENARIO = "scenario";
  public static final String KEY_CONFIDENCE = "confidence";
  public static final String KEY_CONFIDENCE_FINAL = "final";
  public static final String KEY_CONFIDENCE_CLASSIFIER = "classifier";
  public static final String KEY_METRICS = "metrics";
  public static final String KEY_AUDIT = "audit";
  public static final String KEY_LLM_USED = "llm_used";
  public static final String KEY_CACHE_HIT = "cache_hit";
  public static final String KEY_MODEL = "model";
  public static final String KEY_USAGE = "usage";
  public static final String KEY_OUTPUT_SOURCE = "output_source";
  public static final String KEY_API_VERSION = "api_version";
  public static final String KEY_PIPELINE_FINGERPRINT = "pipeline_version_fingerprint";
  public static final String KEY_SCHEMA_VALID = "schema_valid";
  public static final String KEY_SCHEMA_ERRORS = "schema_errors";

  /** Keys every v1.0 record must carry. */
  public static final List<String> REQUIRED_TOP_KEYS = List.of(
      KEY_SCHEMA_VERSION,
      KEY_INPUT_FP,
      KEY_INPUT_LENGTH,
      KEY_OUTPUT_FP,
      KEY_OUTPUT_LENGTH,
      KEY_FREQ_TYPE,
      KEY_MODE,
      KEY_SCENARIO,
      KEY_CONFIDENCE,
      KEY_METRICS,
      KEY_AUDIT,
      KEY_LLM_USED,
      KEY_CACHE_HIT,
      KEY_MODEL,
      KEY_USAGE,
      KEY_OUTPUT_SOURCE,
      KEY_API_VERSION,
      KEY_PIPELINE_FINGERPRINT);

  private final Map<String, Object> fields;

  /**
   * Wraps an already scrubbed and validated record map.
   *
   * @param fields ordered record fields; copied deeply
   */
  public EvidenceRecord(Map<String, Object> fields) {
    this.fields = freezeMap(Objects.requireNonNull(fields, "fields"));
  }

  /**
   * Returns the record in wire form.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, Object> asMap() {
    return fields;
  }

  public String schemaVersion() {
    return stringField(KEY_SCHEMA_VERSION);
  }

  public String inputFingerprint() {
    return stringField(KEY_INPUT_FP);
  }

  public String outputFingerprint() {
    return stringField(KEY_OUTPUT_FP);
  }

  public int inputLength() {
    return intField(KEY_INPUT_LENGTH);
  }

  public int outputLength() {
    return intField(KEY_OUTPUT_LENGTH);
  }

  /**
   * Indicates whether the record passed its own schema checks when it was built.
   *
   * @return value of {@code schema_valid}; {@code false} when absent
   */
  public boolean schemaValid() {
    return Boolean.TRUE.equals(fields.get(KEY_SCHEMA_VALID));
  }

  /**
   * Returns the accumulated schema violation codes.
   *
   * @return violation codes such as {@code missing:confidence.classifier}; empty when valid
   */
  public List<String> schemaErrors() {
    Object raw = fields.get(KEY_SCHEMA_ERRORS);
    if (!(raw instanceof List<?> list)) {
      return List.of();
    }
    List<String> errors = new ArrayList<>(list.size());
    for (Object item : list) {
      errors.add(String.valueOf(item));
    }
    return List.copyOf(errors);
  }

  private String stringField(String key) {
    Object value = fields.get(key);
    return value == null ? null : value.toString();
  }

  private int intField(String key) {
    Object value = fields.get(key);
    return value instanceof Number number ? number.intValue() : -1;
  }

  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof EvidenceRecord that && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "EvidenceRecord" + fields;
  }
}
