package ca.gc.cra.continuum.application.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.application.port.MetricsPort;
import ca.gc.cra.continuum.domain.decision.DecisionState;
import ca.gc.cra.continuum.testing.RecordingMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

  @Test
  void percentilesUseLinearInterpolation() {
    MetricsAggregator aggregator = new MetricsAggregator();
    for (long latency : new long[] {40, 10, 100, 30, 20}) {
      aggregator.record(DecisionState.GUIDE, latency, false, false);
    }

    assertEquals(30.0d, aggregator.percentile(50).getAsDouble());
    assertEquals(88.0d, aggregator.percentile(95).getAsDouble(), 1e-9);
    assertEquals(100.0d, aggregator.percentile(100).getAsDouble());
    assertEquals(10.0d, aggregator.percentile(0).getAsDouble());
  }

  @Test
  void emptyAggregatorReportsNoPercentiles() {
    MetricsAggregator aggregator = new MetricsAggregator();

    assertTrue(aggregator.percentile(50).isEmpty());
    MetricsSnapshot snapshot = aggregator.snapshot();
    assertEquals(0L, snapshot.totalAnalyses());
    assertNull(snapshot.p95LatencyMs());
    assertEquals(0.0d, snapshot.decisionRates().get(DecisionState.BLOCK));
  }

  @Test
  void singleSampleIsEveryPercentile() {
    MetricsAggregator aggregator = new MetricsAggregator();
    aggregator.record(DecisionState.ALLOW, 7, false, false);

    MetricsSnapshot snapshot = aggregator.snapshot();
    assertEquals(7.0d, snapshot.p50LatencyMs());
    assertEquals(7.0d, snapshot.p99LatencyMs());
    assertEquals(7.0d, snapshot.maxLatencyMs());
  }

  @Test
  void windowKeepsMostRecentSamplesButCountsAll() {
    MetricsAggregator aggregator = new MetricsAggregator(3, MetricsPort.NO_OP);
    for (long latency : new long[] {1000, 1, 2, 3}) {
      aggregator.record(DecisionState.BLOCK, latency, false, false);
    }

    MetricsSnapshot snapshot = aggregator.snapshot();
    assertEquals(4L, snapshot.totalAnalyses());
    assertEquals(3, snapshot.windowSize());
    assertEquals(3.0d, snapshot.maxLatencyMs());
  }

  @Test
  void snapshotCountsRatesAndFlags() {
    RecordingMetrics exported = new RecordingMetrics();
    MetricsAggregator aggregator = new MetricsAggregator(10, exported);
    aggregator.record(DecisionState.BLOCK, 5, true, true);
    aggregator.record(DecisionState.GUIDE, 5, true, false);
    aggregator.record(DecisionState.GUIDE, -3, false, false);
    aggregator.record(DecisionState.ALLOW, 5, false, false);

    Map<String, Object> map = aggregator.snapshot().toMap();

    assertEquals(4L, map.get("total_analyses"));
    assertEquals(Map.of("ALLOW", 1L, "GUIDE", 2L, "BLOCK", 1L), map.get("decision_counts"));
    assertEquals(Map.of("ALLOW", 0.25d, "GUIDE", 0.5d, "BLOCK", 0.25d), map.get("decision_rates"));
    assertEquals(2L, map.get("llm_used_true"));
    assertEquals(1L, map.get("oos_hits"));
    assertEquals(10, map.get("window_capacity"));
    assertEquals(2L, exported.counter("analysis.decision.guide"));
    assertEquals(List.of(5L, 5L, 0L, 5L), exported.observations("analysis.latency.ms"));
  }

  @Test
  void concurrentRecordsAreAllCounted() throws Exception {
    MetricsAggregator aggregator = new MetricsAggregator();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        futures.add(pool.submit(() -> {
          for (int i = 0; i < 500; i++) {
            aggregator.record(DecisionState.GUIDE, i, false, false);
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(2000L, aggregator.totalAnalyses());
    assertEquals(2000L, aggregator.snapshot().count(DecisionState.GUIDE));
  }

  @Test
  void nullStateIsIgnored() {
    MetricsAggregator aggregator = new MetricsAggregator();
    aggregator.record(null, 5, false, false);

    assertEquals(0L, aggregator.totalAnalyses());
  }
}
