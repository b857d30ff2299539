package ca.gc.cra.continuum.application.license;

import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Single shared slot for the current {@link LicenseStatus} plus the halt flag.
 * <p><strong>Why:</strong> The watchdog and request threads exchange whole status values; a reader never observes
 * a partially updated status.</p>
 * <p><strong>Thread-safety:</strong> Lock-free; both fields are atomics.</p>
 *
 * @since 0.1.0
 */
public final class LicenseStatusHolder {
  private final AtomicReference<LicenseStatus> current =
      new AtomicReference<>(LicenseStatus.unchecked());
  private final AtomicBoolean halted = new AtomicBoolean();

  public LicenseStatus get() {
    return current.get();
  }

  /**
   * Replaces the held status.
   *
   * @param status new status; must not be {@code null}
   */
  public void set(LicenseStatus status) {
    current.set(Objects.requireNonNull(status, "status"));
  }

  public boolean halted() {
    return halted.get();
  }

  /**
   * Sets or clears the halt flag.
   *
   * @param value new flag value
   * @return previous flag value
   */
  boolean setHalted(boolean value) {
    return halted.getAndSet(value);
  }
}
