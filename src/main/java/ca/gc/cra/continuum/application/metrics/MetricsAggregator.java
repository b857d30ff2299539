package ca.gc.cra.continuum.application.metrics;

import ca.gc.cra.continuum.application.port.MetricsPort;
import ca.gc.cra.continuum.domain.decision.DecisionState;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-process operational metrics for analyzed requests.
 * <p><strong>Why:</strong> Operators need latency percentiles and decision distribution without a metrics backend;
 * the same records are forwarded to {@link MetricsPort} for export.</p>
 * <p><strong>Thread-safety:</strong> One short lock guards the latency window and counters; appends are O(1).</p>
 * <p><strong>Observability:</strong> Forwards {@code analysis.latency.ms} and {@code analysis.decision.<state>}.</p>
 *
 * @since 0.1.0
 */
public final class MetricsAggregator {
  private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

  /** Latency window capacity used when none is configured. */
  public static final int DEFAULT_WINDOW_SIZE = 2000;

  private final ReentrantLock lock = new ReentrantLock();
  private final LatencyWindow window;
  private final MetricsPort metrics;
  private final long[] decisionCounts = new long[DecisionState.values().length];
  private long totalAnalyses;
  private long llmUsedCount;
  private long outOfScopeHits;

  public MetricsAggregator() {
    this(DEFAULT_WINDOW_SIZE, MetricsPort.NO_OP);
  }

  /**
   * Creates an aggregator.
   *
   * @param windowSize latency window capacity; must be positive
   * @param metrics exporter receiving every record
   */
  public MetricsAggregator(int windowSize, MetricsPort metrics) {
    this.window = new LatencyWindow(windowSize);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Records one analyzed request. Never throws.
   *
   * @param state authoritative decision state
   * @param latencyMs end-to-end latency in milliseconds
   * @param llmUsed whether a language model was consulted
   * @param outOfScopeHit whether the engine classified the request out of scope
   */
  public void record(DecisionState state, long latencyMs, boolean llmUsed, boolean outOfScopeHit) {
    if (state == null) {
      log.warn("Ignoring metrics record without decision state");
      return;
    }
    long latency = Math.max(0L, latencyMs);
    lock.lock();
    try {
      window.add(latency);
      totalAnalyses++;
      decisionCounts[state.ordinal()]++;
      if (llmUsed) {
        llmUsedCount++;
      }
      if (outOfScopeHit) {
        outOfScopeHits++;
      }
    } finally {
      lock.unlock();
    }
    try {
      metrics.observe("analysis.latency.ms", latency);
      metrics.increment("analysis.decision." + state.label());
    } catch (RuntimeException ex) {
      log.warn("Metrics export failed for analysis record", ex);
    }
  }

  /**
   * Latency percentile over the current window.
   *
   * @param p percentile in {@code [0, 100]}; values outside clamp to min or max
   * @return percentile in milliseconds, or empty when nothing was recorded
   */
  public OptionalDouble percentile(double p) {
    double[] sorted;
    lock.lock();
    try {
      sorted = window.sortedCopy();
    } finally {
      lock.unlock();
    }
    return LatencyWindow.percentile(sorted, p);
  }

  /**
   * Total analyses recorded since startup; used as license usage.
   *
   * @return monotonic count
   */
  public long totalAnalyses() {
    lock.lock();
    try {
      return totalAnalyses;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Captures a consistent snapshot.
   *
   * @return counts, rates and latency percentiles
   */
  public MetricsSnapshot snapshot() {
    double[] sorted;
    long total;
    long llm;
    long oos;
    long[] counts;
    int capacity;
    lock.lock();
    try {
      sorted = window.sortedCopy();
      total = totalAnalyses;
      llm = llmUsedCount;
      oos = outOfScopeHits;
      counts = decisionCounts.clone();
      capacity = window.capacity();
    } finally {
      lock.unlock();
    }

    Map<DecisionState, Long> countMap = new EnumMap<>(DecisionState.class);
    Map<DecisionState, Double> rateMap = new EnumMap<>(DecisionState.class);
    for (DecisionState state : DecisionState.values()) {
      long count = counts[state.ordinal()];
      countMap.put(state, count);
      rateMap.put(state, total == 0 ? 0.0d : (double) count / total);
    }
    return new MetricsSnapshot(
        total,
        countMap,
        rateMap,
        llm,
        oos,
        boxed(LatencyWindow.percentile(sorted, 50)),
        boxed(LatencyWindow.percentile(sorted, 95)),
        boxed(LatencyWindow.percentile(sorted, 99)),
        boxed(LatencyWindow.percentile(sorted, 100)),
        sorted.length,
        capacity);
  }

  private static Double boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }
}
