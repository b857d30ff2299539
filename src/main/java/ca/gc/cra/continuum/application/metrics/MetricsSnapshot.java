package ca.gc.cra.continuum.application.metrics;

import ca.gc.cra.continuum.domain.decision.DecisionState;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the in-process analysis metrics.
 *
 * @param totalAnalyses analyses recorded since startup
 * @param decisionCounts per-state counts
 * @param decisionRates per-state share of {@code totalAnalyses}; zero when nothing was recorded
 * @param llmUsedCount analyses that consulted a language model
 * @param outOfScopeHits analyses classified out of scope
 * @param p50LatencyMs median latency over the window; {@code null} when the window is empty
 * @param p95LatencyMs 95th percentile latency; {@code null} when the window is empty
 * @param p99LatencyMs 99th percentile latency; {@code null} when the window is empty
 * @param maxLatencyMs maximum latency in the window; {@code null} when the window is empty
 * @param windowSize samples currently held
 * @param windowCapacity maximum samples held
 * @since 0.1.0
 */
public record MetricsSnapshot(
    long totalAnalyses,
    Map<DecisionState, Long> decisionCounts,
    Map<DecisionState, Double> decisionRates,
    long llmUsedCount,
    long outOfScopeHits,
    Double p50LatencyMs,
    Double p95LatencyMs,
    Double p99LatencyMs,
    Double maxLatencyMs,
    int windowSize,
    int windowCapacity) {

  public MetricsSnapshot {
    decisionCounts = Collections.unmodifiableMap(copy(decisionCounts));
    decisionRates = Collections.unmodifiableMap(copy(decisionRates));
  }

  private static <V> Map<DecisionState, V> copy(Map<DecisionState, V> source) {
    Map<DecisionState, V> copy = new EnumMap<>(DecisionState.class);
    if (source != null) {
      copy.putAll(source);
    }
    return copy;
  }

  /**
   * Count for one state.
   *
   * @param state decision state
   * @return count, zero when never recorded
   */
  public long count(DecisionState state) {
    return decisionCounts.getOrDefault(state, 0L);
  }

  /**
   * Renders the snapshot for the metrics endpoint.
   *
   * @return ordered snake_case map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> counts = new LinkedHashMap<>();
    Map<String, Object> rates = new LinkedHashMap<>();
    for (DecisionState state : DecisionState.values()) {
      counts.put(state.name(), count(state));
      rates.put(state.name(), decisionRates.getOrDefault(state, 0.0d));
    }
    Map<String, Object> latency = new LinkedHashMap<>();
    latency.put("p50", p50LatencyMs);
    latency.put("p95", p95LatencyMs);
    latency.put("p99", p99LatencyMs);
    latency.put("max", maxLatencyMs);

    Map<String, Object> map = new LinkedHashMap<>();
    map.put("total_analyses", totalAnalyses);
    map.put("decision_counts", counts);
    map.put("decision_rates", rates);
    map.put("llm_used_true", llmUsedCount);
    map.put("oos_hits", outOfScopeHits);
    map.put("latency_ms", latency);
    map.put("window_size", windowSize);
    map.put("window_capacity", windowCapacity);
    return map;
  }
}
