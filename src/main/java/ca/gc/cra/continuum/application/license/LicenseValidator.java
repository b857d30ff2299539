package ca.gc.cra.continuum.application.license;

import ca.gc.cra.continuum.application.port.ClockPort;
import ca.gc.cra.continuum.application.port.LicenseBackendPort;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a license key and the current usage into a {@link LicenseStatus}.
 * <p><strong>Order of checks:</strong> missing key, revoked, expired (expiry before today UTC), quota exceeded
 * ({@code usage >= quota}), otherwise valid.</p>
 * <p><strong>Failure handling:</strong> backend failures become an invalid
 * {@code validation_exception:<detail>} status; nothing escapes.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the backend is.</p>
 *
 * @since 0.1.0
 */
public final class LicenseValidator {
  private static final Logger log = LoggerFactory.getLogger(LicenseValidator.class);

  private final String licenseKey;
  private final LicenseBackendPort backend;
  private final ClockPort clock;

  /**
   * Creates a validator.
   *
   * @param licenseKey configured license key; blank means no license
   * @param backend entitlement backend
   * @param clock time source for expiry checks and timestamps
   */
  public LicenseValidator(String licenseKey, LicenseBackendPort backend, ClockPort clock) {
    this.licenseKey = licenseKey == null ? "" : licenseKey.trim();
    this.backend = Objects.requireNonNull(backend, "backend");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Validates the license.
   *
   * @param usageCount analyses performed so far
   * @return validation outcome; never {@code null}
   */
  public LicenseStatus validate(long usageCount) {
    Instant now = clock.now();
    if (licenseKey.isEmpty()) {
      return LicenseStatus.invalid(LicenseStatus.REASON_MISSING_KEY, usageCount, now);
    }
    LicenseGrant grant;
    try {
      grant = backend.fetch(licenseKey);
    } catch (IOException | RuntimeException ex) {
      String detail = ex.getClass().getSimpleName()
          + (ex.getMessage() == null ? "" : ": " + ex.getMessage());
      log.warn("License validation failed: {}", detail);
      return LicenseStatus.invalid(LicenseStatus.REASON_EXCEPTION_PREFIX + detail, usageCount, now);
    }
    if (grant == null) {
      return LicenseStatus.invalid(
          LicenseStatus.REASON_EXCEPTION_PREFIX + "empty grant", usageCount, now);
    }

    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    String reason;
    if (!grant.active()) {
      reason = LicenseStatus.REASON_REVOKED;
    } else if (grant.expiryDate() != null && grant.expiryDate().isBefore(today)) {
      reason = LicenseStatus.REASON_EXPIRED;
    } else if (grant.quotaLimit() != null && usageCount >= grant.quotaLimit()) {
      reason = LicenseStatus.REASON_QUOTA_EXCEEDED;
    } else {
      reason = LicenseStatus.REASON_OK;
    }
    Long remaining = grant.quotaLimit() == null ? null : Math.max(0L, grant.quotaLimit() - usageCount);
    return new LicenseStatus(
        LicenseStatus.REASON_OK.equals(reason),
        reason,
        grant.licenseId(),
        grant.expiryDate(),
        grant.quotaLimit(),
        usageCount,
        remaining,
        now);
  }
}
