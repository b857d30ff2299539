package ca.gc.cra.continuum.config;

import ca.gc.cra.continuum.application.license.LicenseGate;
import ca.gc.cra.continuum.application.license.LicenseWatchdog;
import ca.gc.cra.continuum.application.metrics.MetricsAggregator;
import ca.gc.cra.continuum.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.continuum.application.pipeline.FeedbackUseCase;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.domain.license.LicenseStatus;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running audit service: use cases plus the resources that must be released on shutdown.
 *
 * <p>{@link #start()} performs the startup license check and schedules the watchdog; {@link #close()} stops the
 * watchdog and closes the event store and metrics exporter.</p>
 *
 * @since 0.1.0
 */
public final class ContinuumRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ContinuumRuntime.class);

  private final AnalyzeUseCase analyze;
  private final FeedbackUseCase feedback;
  private final RemoteEventWriter writer;
  private final MetricsAggregator metrics;
  private final LicenseGate licenseGate;
  private final LicenseWatchdog watchdog;
  private final EnvironmentConfig environment;
  private final List<AutoCloseable> resources;

  ContinuumRuntime(
      AnalyzeUseCase analyze,
      FeedbackUseCase feedback,
      RemoteEventWriter writer,
      MetricsAggregator metrics,
      LicenseGate licenseGate,
      LicenseWatchdog watchdog,
      EnvironmentConfig environment,
      List<AutoCloseable> resources) {
    this.analyze = Objects.requireNonNull(analyze, "analyze");
    this.feedback = Objects.requireNonNull(feedback, "feedback");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.licenseGate = Objects.requireNonNull(licenseGate, "licenseGate");
    this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.resources = List.copyOf(resources);
  }

  /**
   * Validates the license and starts the watchdog.
   *
   * @return startup license status
   * @throws ca.gc.cra.continuum.application.license.LicensePolicyException in stop mode when the license is
   *     invalid; the watchdog is not started
   */
  public LicenseStatus start() {
    LicenseStatus status = licenseGate.startup();
    watchdog.start();
    return status;
  }

  public AnalyzeUseCase analyze() {
    return analyze;
  }

  public FeedbackUseCase feedback() {
    return feedback;
  }

  public RemoteEventWriter writer() {
    return writer;
  }

  public MetricsAggregator metrics() {
    return metrics;
  }

  public LicenseGate licenseGate() {
    return licenseGate;
  }

  public LicenseWatchdog watchdog() {
    return watchdog;
  }

  public EnvironmentConfig environment() {
    return environment;
  }

  @Override
  public void close() {
    watchdog.close();
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
  }
}
