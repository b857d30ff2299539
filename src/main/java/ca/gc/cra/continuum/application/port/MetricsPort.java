package ca.gc.cra.continuum.application.port;

/**
 * <strong>What:</strong> Port abstracting export of analysis counters and latency observations.
 * <p><strong>Why:</strong> The in-process metrics aggregator forwards every record to an external backend without
 * binding the pipeline to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from request threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract, e.g. {@code analysis.latency.ms} and
 * {@code analysis.decision.block}.</p>
 *
 * @implNote Callers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value; units are defined by the metric name
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
