package ca.gc.cra.continuum.application.license;

import ca.gc.cra.continuum.domain.license.EnforcementMode;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import ca.gc.cra.continuum.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Background task that re-validates the license at a fixed interval.
 * <p><strong>Why:</strong> Revocation, expiry and quota exhaustion must take effect while the service keeps
 * running, without every request paying for a backend call.</p>
 * <p><strong>Behaviour:</strong> each cycle replaces the held status. In {@link EnforcementMode#STOP} an invalid
 * status sets the halt flag and a later valid status clears it; in {@link EnforcementMode#DEGRADE} invalid
 * statuses are only logged.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} schedules cycles on a dedicated daemon thread; {@link #close()}
 * cancels them and waits a bounded time before forcing shutdown.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} are expected from one lifecycle thread;
 * {@link #runOnce()} may run concurrently with request threads.</p>
 *
 * @since 0.1.0
 */
public final class LicenseWatchdog implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LicenseWatchdog.class);

  /** Shortest allowed interval between cycles. */
  public static final Duration MIN_INTERVAL = Duration.ofSeconds(60);
  /** Interval used when none is configured. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(300);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

  private final LicenseValidator validator;
  private final LicenseStatusHolder holder;
  private final EnforcementMode mode;
  private final Duration interval;
  private final LongSupplier usage;
  private ScheduledExecutorService scheduler;

  /**
   * Creates a watchdog.
   *
   * @param validator license validator
   * @param holder shared status slot
   * @param mode enforcement mode
   * @param interval requested interval; raised to {@link #MIN_INTERVAL} when shorter
   * @param usage supplier of the current usage count
   */
  public LicenseWatchdog(
      LicenseValidator validator,
      LicenseStatusHolder holder,
      EnforcementMode mode,
      Duration interval,
      LongSupplier usage) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.holder = Objects.requireNonNull(holder, "holder");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.interval = clampInterval(interval);
    this.usage = Objects.requireNonNull(usage, "usage");
  }

  /**
   * Applies the interval floor.
   *
   * @param requested requested interval; {@code null} selects {@link #DEFAULT_INTERVAL}
   * @return effective interval, never shorter than {@link #MIN_INTERVAL}
   */
  public static Duration clampInterval(Duration requested) {
    if (requested == null) {
      return DEFAULT_INTERVAL;
    }
    return requested.compareTo(MIN_INTERVAL) < 0 ? MIN_INTERVAL : requested;
  }

  public Duration interval() {
    return interval;
  }

  /**
   * Schedules periodic validation. The first cycle runs one interval from now.
   *
   * @throws IllegalStateException when already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("License watchdog already started");
    }
    scheduler = ExecutorFactories.newWatchdogScheduler(
        "continuum-license-watchdog",
        (thread, ex) -> log.error("License watchdog thread {} failed", thread.getName(), ex));
    long millis = interval.toMillis();
    scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
    log.info("License watchdog started (mode={}, interval={}s)", mode, interval.toSeconds());
  }

  /**
   * Indicates whether periodic validation is scheduled.
   *
   * @return {@code true} between {@link #start()} and {@link #close()}
   */
  public synchronized boolean running() {
    return scheduler != null && !scheduler.isShutdown();
  }

  /**
   * Runs one validation cycle.
   *
   * @return status stored by this cycle, or the previously held status when the cycle failed
   */
  public LicenseStatus runOnce() {
    try {
      LicenseStatus status = validator.validate(usage.getAsLong());
      holder.set(status);
      if (status.valid()) {
        if (holder.setHalted(false)) {
          log.info("License valid again; resuming request admission");
        }
      } else if (mode == EnforcementMode.STOP) {
        if (!holder.setHalted(true)) {
          log.error("License invalid ({}); halting request admission", status.reason());
        }
      } else {
        log.warn("License invalid ({}); continuing in degrade mode", status.reason());
      }
      return status;
    } catch (RuntimeException ex) {
      // Keep the periodic task alive; a throwing task would cancel later cycles.
      log.error("License watchdog cycle failed", ex);
      return holder.get();
    }
  }

  /**
   * Cancels periodic validation, waiting up to five seconds before forcing shutdown.
   */
  @Override
  public synchronized void close() {
    ScheduledExecutorService executor = scheduler;
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("License watchdog still running after {} ms; forcing shutdown", SHUTDOWN_WAIT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("License watchdog stopped");
  }
}
