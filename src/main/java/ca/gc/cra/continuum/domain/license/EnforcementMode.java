package ca.gc.cra.continuum.domain.license;

import java.util.Locale;

/**
 * How an invalid license affects request admission.
 *
 * @since 0.1.0
 */
public enum EnforcementMode {
  /** Invalid license is logged; requests keep flowing. */
  DEGRADE,
  /** Invalid license aborts startup and halts request admission. */
  STOP;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code degrade} or {@code stop}, any case; blank means {@link #DEGRADE}
   * @return parsed mode
   * @throws IllegalArgumentException when the value is not recognized
   */
  public static EnforcementMode from(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEGRADE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "degrade" -> DEGRADE;
      case "stop" -> STOP;
      default -> throw new IllegalArgumentException("license.mode must be 'degrade' or 'stop' (was " + raw + ")");
    };
  }
}
