package ca.gc.cra.continuum.domain.evidence;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable audit event created once per analyzed request.
 * <p><strong>Why:</strong> Couples the evidence record with the input fingerprint and content-free metadata so
 * a single remote object describes the whole decision.</p>
 * <p><strong>Role:</strong> Owned by the remote event writer once submitted; never mutated locally.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; metadata is copied on construction.</p>
 *
 * @param id opaque event id, also returned to callers as {@code log_id}
 * @param timestamp creation instant (UTC)
 * @param input fingerprint of the request text
 * @param salted whether {@code input} was computed with a non-empty salt
 * @param evidence scrubbed, validated evidence record
 * @param metadata content-free metadata (decision state, lengths, latency); scalar values only
 * @since 0.1.0
 */
public record AnalysisEvent(
    String id,
    Instant timestamp,
    Fingerprint input,
    boolean salted,
    EvidenceRecord evidence,
    Map<String, Object> metadata) {

  /**
   * Validates invariants and copies metadata.
   */
  public AnalysisEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(evidence, "evidence");
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /**
   * Renders the event in the wire layout written to the remote store.
   *
   * @return ordered map {@code {id, timestamp, input, evidence, metadata}}
   */
  public Map<String, Object> toWireMap() {
    Map<String, Object> inputSection = new LinkedHashMap<>();
    inputSection.put("fingerprint_sha256", input.sha256Hex());
    inputSection.put("length", input.length());
    inputSection.put("salted", salted);

    Map<String, Object> wire = new LinkedHashMap<>();
    wire.put("id", id);
    wire.put("timestamp", timestamp.toString());
    wire.put("input", inputSection);
    wire.put("evidence", evidence.asMap());
    wire.put("metadata", metadata);
    return wire;
  }
}
