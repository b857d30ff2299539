package ca.gc.cra.continuum.domain.evidence;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Operator or end-user feedback about a previously logged analysis.
 * <p><strong>Why:</strong> Feedback is keyed by the opaque analysis id only, so it never needs or stores content.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id opaque feedback id
 * @param timestamp creation instant (UTC)
 * @param targetLogId analysis id the feedback refers to; existence is not checked
 * @param accuracy accuracy score in {@code [0, 5]}
 * @param helpful helpfulness score in {@code [0, 5]}
 * @param accepted whether the suggested output was accepted
 * @since 0.1.0
 */
public record FeedbackEvent(
    String id,
    Instant timestamp,
    String targetLogId,
    int accuracy,
    int helpful,
    boolean accepted) {

  /** Lowest accepted score. */
  public static final int MIN_SCORE = 0;
  /** Highest accepted score. */
  public static final int MAX_SCORE = 5;

  /**
   * Validates identifiers and score bounds.
   */
  public FeedbackEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(targetLogId, "targetLogId");
    checkScore("accuracy", accuracy);
    checkScore("helpful", helpful);
  }

  private static void checkScore(String name, int value) {
    if (value < MIN_SCORE || value > MAX_SCORE) {
      throw new IllegalArgumentException(
          name + " must be between " + MIN_SCORE + " and " + MAX_SCORE + " (was " + value + ")");
    }
  }

  /**
   * Renders the feedback in the wire layout written to the remote store.
   *
   * @return ordered map {@code {id, timestamp, target_log_id, feedback}}
   */
  public Map<String, Object> toWireMap() {
    Map<String, Object> scores = new LinkedHashMap<>();
    scores.put("accuracy", accuracy);
    scores.put("helpful", helpful);
    scores.put("accepted", accepted);

    Map<String, Object> wire = new LinkedHashMap<>();
    wire.put("id", id);
    wire.put("timestamp", timestamp.toString());
    wire.put("target_log_id", targetLogId);
    wire.put("feedback", scores);
    return wire;
  }
}
