package ca.gc.cra.continuum.application.license;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.domain.license.EnforcementMode;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import ca.gc.cra.continuum.testing.MutableClock;
import ca.gc.cra.continuum.testing.StaticGrants;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class LicenseGateTest {
  private static final LicenseGrant VALID = new LicenseGrant("lic-1", LocalDate.parse("2030-01-01"), null, true);
  private static final LicenseGrant REVOKED = new LicenseGrant("lic-1", null, null, false);

  private final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));

  private LicenseGate gate(StaticGrants grants, EnforcementMode mode, LicenseStatusHolder holder) {
    LicenseValidator validator = new LicenseValidator("key", grants, clock);
    return new LicenseGate(validator, holder, mode, Duration.ofMinutes(5), () -> 0L, clock);
  }

  @Test
  void startupStoresValidStatus() {
    LicenseStatusHolder holder = new LicenseStatusHolder();

    LicenseStatus status = gate(new StaticGrants(VALID), EnforcementMode.STOP, holder).startup();

    assertTrue(status.valid());
    assertEquals(status, holder.get());
  }

  @Test
  void stopModeRefusesToStartWithInvalidLicense() {
    LicenseStatusHolder holder = new LicenseStatusHolder();
    LicenseGate gate = gate(new StaticGrants(REVOKED), EnforcementMode.STOP, holder);

    LicensePolicyException ex = assertThrows(LicensePolicyException.class, gate::startup);

    assertEquals(LicenseStatus.REASON_REVOKED, ex.reason());
    assertFalse(holder.get().valid());
  }

  @Test
  void degradeModeAdmitsDespiteInvalidLicense() {
    LicenseGate gate = gate(new StaticGrants(REVOKED), EnforcementMode.DEGRADE, new LicenseStatusHolder());

    assertFalse(gate.startup().valid());
    assertFalse(gate.admit().valid());
  }

  @Test
  void admitReusesFreshStatusAndRevalidatesWhenStale() {
    StaticGrants grants = new StaticGrants(VALID);
    LicenseGate gate = gate(grants, EnforcementMode.STOP, new LicenseStatusHolder());
    gate.startup();

    gate.admit();
    gate.admit();
    assertEquals(1, grants.fetches());

    grants.replace(REVOKED);
    clock.advance(Duration.ofMinutes(5));
    assertThrows(LicensePolicyException.class, gate::admit);
    assertEquals(2, grants.fetches());
  }

  @Test
  void uncheckedStatusIsValidatedOnFirstAdmit() {
    StaticGrants grants = new StaticGrants(VALID);
    LicenseGate gate = gate(grants, EnforcementMode.DEGRADE, new LicenseStatusHolder());

    assertTrue(gate.admit().valid());
    assertEquals(1, grants.fetches());
  }

  @Test
  void haltedStopModeRejectsWithoutRevalidating() {
    StaticGrants grants = new StaticGrants(VALID);
    LicenseStatusHolder holder = new LicenseStatusHolder();
    LicenseGate gate = gate(grants, EnforcementMode.STOP, holder);
    gate.startup();
    holder.setHalted(true);

    assertThrows(LicensePolicyException.class, gate::admit);
    assertEquals(1, grants.fetches());
  }
}
