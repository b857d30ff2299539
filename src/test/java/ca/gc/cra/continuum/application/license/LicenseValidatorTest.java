package ca.gc.cra.continuum.application.license;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.domain.license.LicenseGrant;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import ca.gc.cra.continuum.testing.MutableClock;
import ca.gc.cra.continuum.testing.StaticGrants;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class LicenseValidatorTest {
  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
  private final MutableClock clock = new MutableClock(NOW);

  private LicenseStatus validate(LicenseGrant grant, long usage) {
    return new LicenseValidator("key-1", new StaticGrants(grant), clock).validate(usage);
  }

  @Test
  void activeGrantWithinQuotaIsValid() {
    LicenseStatus status = validate(new LicenseGrant("lic-1", LocalDate.parse("2025-06-01"), 100L, true), 40);

    assertTrue(status.valid());
    assertEquals(LicenseStatus.REASON_OK, status.reason());
    assertEquals(60L, status.quotaRemaining());
    assertEquals(NOW, status.checkedAt());
  }

  @Test
  void blankKeyIsMissing() {
    LicenseStatus status = new LicenseValidator("  ", new StaticGrants(null), clock).validate(0);

    assertFalse(status.valid());
    assertEquals(LicenseStatus.REASON_MISSING_KEY, status.reason());
  }

  @Test
  void checksRunInRevokedExpiredQuotaOrder() {
    LocalDate past = LocalDate.parse("2025-05-31");

    assertEquals(LicenseStatus.REASON_REVOKED, validate(new LicenseGrant("l", past, 1L, false), 5).reason());
    assertEquals(LicenseStatus.REASON_EXPIRED, validate(new LicenseGrant("l", past, 1L, true), 5).reason());
    assertEquals(LicenseStatus.REASON_QUOTA_EXCEEDED,
        validate(new LicenseGrant("l", null, 5L, true), 5).reason());
  }

  @Test
  void quotaRemainingFloorsAtZeroAndUnlimitedIsNull() {
    assertEquals(0L, validate(new LicenseGrant("l", null, 5L, true), 9).quotaRemaining());
    LicenseStatus unlimited = validate(new LicenseGrant("l", null, null, true), 1_000_000);
    assertTrue(unlimited.valid());
    assertNull(unlimited.quotaRemaining());
  }

  @Test
  void backendFailureBecomesInvalidStatus() {
    LicenseValidator validator = new LicenseValidator("key-1", key -> {
      throw new IOException("connection refused");
    }, clock);

    LicenseStatus status = validator.validate(3);

    assertFalse(status.valid());
    assertEquals("validation_exception:IOException: connection refused", status.reason());
    assertEquals(3L, status.usageCount());
  }

  @Test
  void emptyGrantIsInvalid() {
    LicenseStatus status = validate(null, 0);

    assertFalse(status.valid());
    assertTrue(status.reason().startsWith(LicenseStatus.REASON_EXCEPTION_PREFIX));
  }
}
