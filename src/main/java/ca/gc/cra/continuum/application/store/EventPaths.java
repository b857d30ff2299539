package ca.gc.cra.continuum.application.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Date-bucketed object names for audit events, e.g. {@code events/2025/01/31/analysis_<id>.json}.
 *
 * @since 0.1.0
 */
public final class EventPaths {
  private EventPaths() {}

  public static String analysis(Instant timestamp, String id) {
    return path("events", "analysis_", timestamp, id);
  }

  public static String feedback(Instant timestamp, String id) {
    return path("feedback", "feedback_", timestamp, id);
  }

  private static String path(String root, String prefix, Instant timestamp, String id) {
    LocalDate day = LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    return String.format(
        Locale.ROOT,
        "%s/%04d/%02d/%02d/%s%s.json",
        root,
        day.getYear(),
        day.getMonthValue(),
        day.getDayOfMonth(),
        prefix,
        id);
  }
}
