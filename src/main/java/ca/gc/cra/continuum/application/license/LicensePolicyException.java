package ca.gc.cra.continuum.application.license;

/**
 * Raised when license enforcement rejects a request or startup.
 *
 * <p>This is an intentional policy outcome (503-equivalent), not an infrastructure failure.</p>
 *
 * @since 0.1.0
 */
public class LicensePolicyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String reason;

  /**
   * Creates a policy rejection.
   *
   * @param message operator-facing message
   * @param reason license status reason such as {@code expired}
   */
  public LicensePolicyException(String message, String reason) {
    super(message);
    this.reason = reason;
  }

  /**
   * Returns the license status reason behind the rejection.
   *
   * @return reason code
   */
  public String reason() {
    return reason;
  }
}
