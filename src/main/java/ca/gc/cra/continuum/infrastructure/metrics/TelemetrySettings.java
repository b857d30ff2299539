package ca.gc.cra.continuum.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Effective OpenTelemetry export settings.
 *
 * <p>Built from the {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} settings;
 * blank values fall back to the OTLP defaults.</p>
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes
 * @param exportInterval periodic export interval
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter, String endpoint, String resourceAttributes, Duration exportInterval) {

  static final String DEFAULT_EXPORTER = "otlp";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank()
        ? DEFAULT_EXPORTER
        : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    exportInterval = Objects.requireNonNullElse(exportInterval, Duration.ofSeconds(30));
  }

  /**
   * Settings with export disabled.
   *
   * @return settings whose exporter is {@code none}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null, null);
  }

  public boolean enabled() {
    return !"none".equals(exporter);
  }
}
