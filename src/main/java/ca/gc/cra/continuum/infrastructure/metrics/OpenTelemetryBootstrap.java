package ca.gc.cra.continuum.infrastructure.metrics;

import ca.gc.cra.continuum.domain.evidence.EvidenceRecord;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the audit service.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.continuum";
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static MeterHandle initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return MeterHandle.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(settings.exportInterval())
          .build();
      MeterHandle handle = open(reader, parseResourceAttributes(settings.resourceAttributes()));
      log.info("OpenTelemetry metrics exporting via OTLP to {} every {}s",
          settings.endpoint(), settings.exportInterval().toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle open(MetricReader reader, Attributes extra) {
    Resource resource = Resource.getDefault().merge(Resource.create(serviceAttributes()));
    if (!extra.isEmpty()) {
      resource = resource.merge(Resource.create(extra));
    }
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(EvidenceRecord.API_VERSION)
        .build();
    return new MeterHandle(meter, provider);
  }

  private static Attributes serviceAttributes() {
    return Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "continuum-audit")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), EvidenceRecord.API_VERSION)
        .put(AttributeKey.stringKey("service.instance.id"), "pid-" + ProcessHandle.current().pid())
        .build();
  }

  /**
   * Parses {@code key=value,key=value} resource attributes; malformed entries are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      if (entry.isEmpty()) {
        continue;
      }
      if (idx <= 0 || idx == entry.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", entry);
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, idx).trim()), entry.substring(idx + 1).trim());
    }
    return builder.build();
  }

  /**
   * Meter plus the provider that owns it; {@code provider} is {@code null} for the noop meter.
   */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    boolean exporting() {
      return provider != null;
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String action) {
      if (!pending.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}s", action, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
