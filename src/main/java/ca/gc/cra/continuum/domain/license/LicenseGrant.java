package ca.gc.cra.continuum.domain.license;

import java.time.LocalDate;

/**
 * Entitlement returned by a license backend for one license key.
 *
 * @param licenseId backend identifier for the license
 * @param expiryDate last valid day (UTC); {@code null} means no expiry
 * @param quotaLimit maximum number of analyses; {@code null} means unlimited
 * @param active {@code false} when the license was revoked
 * @since 0.1.0
 */
public record LicenseGrant(String licenseId, LocalDate expiryDate, Long quotaLimit, boolean active) {}
