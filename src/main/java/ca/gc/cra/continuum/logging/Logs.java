package ca.gc.cra.continuum.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep request content out of operator logs.
 * <p><strong>Why:</strong> The audit pipeline handles raw request text; logs must only ever show its shape.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Describes text by its length only.
   *
   * @param text request or response text; may be {@code null}
   * @return {@code len=<n>}, or {@code <null>}
   */
  public static String describe(CharSequence text) {
    if (text == null) {
      return NULL_PLACEHOLDER;
    }
    return "len=" + text.length();
  }

  /**
   * Returns a standard placeholder for secrets such as tokens and license keys.
   *
   * @param value ignored original value; a blank value is shown as {@code <unset>}
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    if (value == null || value.isBlank()) {
      return "<unset>";
    }
    return REDACTED_PLACEHOLDER;
  }
}
