package ca.gc.cra.continuum.application.license;

import ca.gc.cra.continuum.application.port.ClockPort;
import ca.gc.cra.continuum.domain.license.EnforcementMode;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Request admission check backed by the shared license status.
 * <p><strong>Behaviour:</strong>
 * <ul>
 *   <li>{@link #startup()} validates once; in {@link EnforcementMode#STOP} an invalid license aborts startup.</li>
 *   <li>{@link #admit()} re-validates synchronously only when the held status is older than the interval, so
 *   back-to-back requests reuse one backend answer.</li>
 *   <li>In {@link EnforcementMode#STOP} a halted or invalid status rejects the request before any engine call;
 *   in {@link EnforcementMode#DEGRADE} it is logged and the request proceeds.</li>
 * </ul>
 * <p>Only the watchdog sets or clears the halt flag.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent requests; refreshes are serialized.</p>
 *
 * @since 0.1.0
 */
public final class LicenseGate {
  private static final Logger log = LoggerFactory.getLogger(LicenseGate.class);

  private final LicenseValidator validator;
  private final LicenseStatusHolder holder;
  private final EnforcementMode mode;
  private final Duration interval;
  private final LongSupplier usage;
  private final ClockPort clock;
  private final Object refreshLock = new Object();

  /**
   * Creates a gate.
   *
   * @param validator license validator
   * @param holder shared status slot, also updated by the watchdog
   * @param mode enforcement mode
   * @param interval freshness window for the held status
   * @param usage supplier of the current usage count
   * @param clock time source
   */
  public LicenseGate(
      LicenseValidator validator,
      LicenseStatusHolder holder,
      EnforcementMode mode,
      Duration interval,
      LongSupplier usage,
      ClockPort clock) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.holder = Objects.requireNonNull(holder, "holder");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.usage = Objects.requireNonNull(usage, "usage");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Performs the startup validation.
   *
   * @return status stored in the holder
   * @throws LicensePolicyException in stop mode when the license is invalid
   */
  public LicenseStatus startup() {
    LicenseStatus status = validator.validate(usage.getAsLong());
    holder.set(status);
    if (status.valid()) {
      log.info("License valid (id={}, expiry={})", status.licenseId(), status.expiryDate());
      return status;
    }
    if (mode == EnforcementMode.STOP) {
      throw new LicensePolicyException("License invalid at startup: " + status.reason(), status.reason());
    }
    log.warn("License invalid at startup ({}); continuing in degrade mode", status.reason());
    return status;
  }

  /**
   * Admits or rejects one request.
   *
   * @return status the decision was based on
   * @throws LicensePolicyException in stop mode when halted or invalid
   */
  public LicenseStatus admit() {
    if (mode == EnforcementMode.STOP && holder.halted()) {
      LicenseStatus held = holder.get();
      throw new LicensePolicyException("Service halted by license watchdog: " + held.reason(), held.reason());
    }
    LicenseStatus status = freshStatus();
    if (!status.valid()) {
      if (mode == EnforcementMode.STOP) {
        throw new LicensePolicyException("License invalid: " + status.reason(), status.reason());
      }
      log.warn("License invalid ({}); request admitted in degrade mode", status.reason());
    }
    return status;
  }

  public EnforcementMode mode() {
    return mode;
  }

  public LicenseStatusHolder holder() {
    return holder;
  }

  private LicenseStatus freshStatus() {
    LicenseStatus status = holder.get();
    if (!stale(status)) {
      return status;
    }
    synchronized (refreshLock) {
      status = holder.get();
      if (!stale(status)) {
        return status;
      }
      status = validator.validate(usage.getAsLong());
      holder.set(status);
      log.debug("License re-validated on request path: {}", status.reason());
      return status;
    }
  }

  private boolean stale(LicenseStatus status) {
    if (!status.checked()) {
      return true;
    }
    long ageMillis = clock.nowMillis() - status.checkedAt().toEpochMilli();
    return ageMillis >= interval.toMillis();
  }
}
