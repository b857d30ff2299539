package ca.gc.cra.continuum.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }

  @Test
  void countersAndHistogramsReachTheReader() {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader))) {
      adapter.increment("analysis.decision.block");
      adapter.increment("analysis.decision.block");
      adapter.observe("analysis.latency.ms", 42);

      Collection<MetricData> metrics = reader.collectAllMetrics();

      MetricData counter = find(metrics, "analysis.decision.block");
      LongPointData point = counter.getLongSumData().getPoints().iterator().next();
      assertEquals(2L, point.getValue());
      assertEquals("analysis.decision.block",
          point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));

      MetricData histogram = find(metrics, "analysis.latency.ms");
      assertEquals("ms", histogram.getUnit());
      HistogramPointData latency = histogram.getHistogramData().getPoints().iterator().next();
      assertEquals(1L, latency.getCount());
      assertEquals(42.0d, latency.getSum());
      assertTrue(adapter.exporting());
    }
  }

  @Test
  void disabledSettingsGiveNoopAdapter() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      adapter.increment("anything");
      adapter.observe("anything.ms", 1);

      assertFalse(adapter.exporting());
    }
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("continuum.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("store.write_failed", OpenTelemetryMetricsAdapter.sanitizeName("Store.Write Failed"));
  }

  @Test
  void parsesResourceAttributeList() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod, bad, team = audit ,=x");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("audit", attributes.get(AttributeKey.stringKey("team")));
  }
}
