package ca.gc.cra.continuum.domain.license;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of one license validation.
 * <p><strong>Why:</strong> Request threads and the watchdog exchange this value whole, so readers never see a
 * half-updated status.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; replaced atomically by the status holder.</p>
 *
 * @param valid whether the license currently admits requests
 * @param reason {@code ok}, {@code unchecked}, or a failure code such as {@code expired}
 * @param licenseId backend license id; may be {@code null}
 * @param expiryDate expiry day; may be {@code null}
 * @param quotaLimit quota; {@code null} means unlimited
 * @param usageCount usage observed at validation time
 * @param quotaRemaining remaining quota, floored at zero; {@code null} when unlimited
 * @param checkedAt instant of the check; {@link Instant#EPOCH} when never checked
 * @since 0.1.0
 */
public record LicenseStatus(
    boolean valid,
    String reason,
    String licenseId,
    LocalDate expiryDate,
    Long quotaLimit,
    long usageCount,
    Long quotaRemaining,
    Instant checkedAt) {

  public static final String REASON_OK = "ok";
  public static final String REASON_UNCHECKED = "unchecked";
  public static final String REASON_MISSING_KEY = "missing_license_key";
  public static final String REASON_REVOKED = "revoked";
  public static final String REASON_EXPIRED = "expired";
  public static final String REASON_QUOTA_EXCEEDED = "quota_exceeded";
  public static final String REASON_EXCEPTION_PREFIX = "validation_exception:";

  private static final LicenseStatus UNCHECKED =
      new LicenseStatus(false, REASON_UNCHECKED, null, null, null, 0L, null, Instant.EPOCH);

  /**
   * Validates required fields.
   */
  public LicenseStatus {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(checkedAt, "checkedAt");
  }

  /**
   * Status held before the first validation.
   *
   * @return shared unchecked status
   */
  public static LicenseStatus unchecked() {
    return UNCHECKED;
  }

  /**
   * Builds an invalid status carrying only a reason.
   *
   * @param reason failure code
   * @param usageCount usage observed at validation time
   * @param checkedAt instant of the check
   * @return invalid status
   */
  public static LicenseStatus invalid(String reason, long usageCount, Instant checkedAt) {
    return new LicenseStatus(false, reason, null, null, null, usageCount, null, checkedAt);
  }

  /**
   * Indicates whether this status came from an actual validation.
   *
   * @return {@code false} only for the unchecked placeholder
   */
  public boolean checked() {
    return !REASON_UNCHECKED.equals(reason);
  }

  /**
   * Renders the status for the license status endpoint.
   *
   * @return ordered snake_case map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("valid", valid);
    map.put("reason", reason);
    map.put("license_id", licenseId);
    map.put("expiry_date", expiryDate == null ? null : expiryDate.toString());
    map.put("quota_limit", quotaLimit);
    map.put("usage_count", usageCount);
    map.put("quota_remaining", quotaRemaining);
    map.put("checked_at_utc", checkedAt.toString());
    return map;
  }
}
