package ca.gc.cra.continuum.config;

import ca.gc.cra.continuum.application.decision.DecisionNormalizer;
import ca.gc.cra.continuum.application.evidence.EvidenceBuilder;
import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.license.LicenseGate;
import ca.gc.cra.continuum.application.license.LicenseStatusHolder;
import ca.gc.cra.continuum.application.license.LicenseValidator;
import ca.gc.cra.continuum.application.license.LicenseWatchdog;
import ca.gc.cra.continuum.application.metrics.MetricsAggregator;
import ca.gc.cra.continuum.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.continuum.application.pipeline.FeedbackUseCase;
import ca.gc.cra.continuum.application.port.ClockPort;
import ca.gc.cra.continuum.application.port.DecisionEnginePort;
import ca.gc.cra.continuum.application.port.EventStorePort;
import ca.gc.cra.continuum.application.port.LicenseBackendPort;
import ca.gc.cra.continuum.application.port.MetricsPort;
import ca.gc.cra.continuum.application.scrub.ContentScrubber;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.domain.evidence.Fingerprinter;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import ca.gc.cra.continuum.infrastructure.engine.HttpDecisionEngine;
import ca.gc.cra.continuum.infrastructure.license.HttpLicenseBackend;
import ca.gc.cra.continuum.infrastructure.license.StaticLicenseBackend;
import ca.gc.cra.continuum.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.continuum.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.continuum.infrastructure.store.FileEventStore;
import ca.gc.cra.continuum.infrastructure.store.GitHubContentEventStore;
import ca.gc.cra.continuum.infrastructure.store.KafkaEventStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the audit use cases to concrete adapters from a {@link ContinuumConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection (store backend, license backend, engine client, metrics
 * export) in one place so use cases only see ports.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup; the built runtime is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ContinuumConfig config;
  private final EnvironmentConfig environment;
  private final ClockPort clock;

  public CompositionRoot(ContinuumConfig config, EnvironmentConfig environment) {
    this(config, environment, ClockPort.SYSTEM);
  }

  CompositionRoot(ContinuumConfig config, EnvironmentConfig environment, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the runtime with the configured Decision Engine, if any.
   *
   * @return runtime; call {@link ContinuumRuntime#start()} before serving requests
   */
  public ContinuumRuntime build() {
    return build(engine());
  }

  /**
   * Builds the runtime around an explicit engine.
   *
   * @param engine engine to use; {@code null} leaves the analyze path in replay-only mode
   * @return runtime; call {@link ContinuumRuntime#start()} before serving requests
   */
  public ContinuumRuntime build(DecisionEnginePort engine) {
    List<AutoCloseable> resources = new ArrayList<>();
    OpenTelemetryMetricsAdapter otel = new OpenTelemetryMetricsAdapter(telemetrySettings());
    resources.add(otel);
    MetricsPort metricsPort = otel.exporting() ? otel : MetricsPort.NO_OP;

    MetricsAggregator metrics = new MetricsAggregator(config.metricsWindowSize(), metricsPort);

    EventStorePort store = eventStore();
    if (store != null) {
      resources.add(0, store);
    }
    RemoteEventWriter writer = new RemoteEventWriter(store, new JsonSupport());

    LicenseValidator validator = new LicenseValidator(config.license().key(), licenseBackend(), clock);
    LicenseStatusHolder holder = new LicenseStatusHolder();
    Duration interval = LicenseWatchdog.clampInterval(config.license().watchdogInterval());
    LicenseGate gate = new LicenseGate(
        validator, holder, config.license().mode(), interval, metrics::totalAnalyses, clock);
    LicenseWatchdog watchdog = new LicenseWatchdog(
        validator, holder, config.license().mode(), interval, metrics::totalAnalyses);

    Fingerprinter fingerprinter = new Fingerprinter(config.fingerprintSalt());
    AnalyzeUseCase analyze = new AnalyzeUseCase(
        engine,
        gate,
        new DecisionNormalizer(),
        new EvidenceBuilder(fingerprinter, new ContentScrubber()),
        fingerprinter,
        writer,
        metrics,
        clock,
        config.maxInputLength());
    FeedbackUseCase feedback = new FeedbackUseCase(writer, clock);

    log.info("Composed audit runtime (store={}, engine={}, license={}/{}, salted={})",
        writer.kind(),
        engine == null ? "none" : engine.getClass().getSimpleName(),
        config.license().backend(),
        config.license().mode(),
        fingerprinter.salted());
    return new ContinuumRuntime(
        analyze, feedback, writer, metrics, gate, watchdog, environment, resources);
  }

  EventStorePort eventStore() {
    ContinuumConfig.Store store = config.store();
    return switch (store.kind()) {
      case GITHUB -> new GitHubContentEventStore(
          store.githubApiUrl(), store.githubRepo(), store.githubToken(), store.githubBranch(), store.timeout());
      case KAFKA -> new KafkaEventStore(store.kafkaBootstrap(), store.kafkaTopic(), store.timeout());
      case FILE -> new FileEventStore(store.fileDir());
      case NONE, AUTO -> null;
    };
  }

  LicenseBackendPort licenseBackend() {
    ContinuumConfig.License license = config.license();
    if (license.backend() == ContinuumConfig.LicenseBackend.HTTP) {
      return new HttpLicenseBackend(license.endpoint(), license.timeout());
    }
    return new StaticLicenseBackend(
        new LicenseGrant(license.licenseId(), license.expiry(), license.quota(), true));
  }

  DecisionEnginePort engine() {
    ContinuumConfig.Engine engine = config.engine();
    return engine.configured() ? new HttpDecisionEngine(engine.url(), engine.timeout()) : null;
  }

  TelemetrySettings telemetrySettings() {
    ContinuumConfig.Telemetry telemetry = config.telemetry();
    return new TelemetrySettings(
        telemetry.exporter(), telemetry.endpoint(), telemetry.resourceAttributes(), null);
  }
}
