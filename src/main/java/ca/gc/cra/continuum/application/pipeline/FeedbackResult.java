package ca.gc.cra.continuum.application.pipeline;

import ca.gc.cra.continuum.application.store.WriteReceipt;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one feedback submission.
 *
 * @param feedbackId opaque feedback id
 * @param writeReceipt outcome of the remote write
 * @since 0.1.0
 */
public record FeedbackResult(String feedbackId, WriteReceipt writeReceipt) {

  public Map<String, Object> toResponseMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("status", "success");
    map.put("feedback_id", feedbackId);
    map.put("write_status", writeReceipt.status().name().toLowerCase(Locale.ROOT));
    return map;
  }
}
