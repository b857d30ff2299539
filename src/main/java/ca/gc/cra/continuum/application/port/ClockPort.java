package ca.gc.cra.continuum.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the audit pipeline.
 * <p><strong>Why:</strong> Event timestamps, date-bucketed store paths, license expiry checks and watchdog
 * freshness all read the clock; tests substitute a fixed one.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads from request and
 * watchdog threads.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current instant.
   *
   * @return instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
