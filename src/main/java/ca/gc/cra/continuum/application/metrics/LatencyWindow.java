package ca.gc.cra.continuum.application.metrics;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Fixed-capacity FIFO of latency samples backed by a ring buffer.
 *
 * <p>Not thread-safe; {@link MetricsAggregator} guards every access with its lock.</p>
 *
 * @since 0.1.0
 */
final class LatencyWindow {
  private final double[] samples;
  private int next;
  private int size;

  LatencyWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.samples = new double[capacity];
  }

  void add(double value) {
    samples[next] = value;
    next = (next + 1) % samples.length;
    if (size < samples.length) {
      size++;
    }
  }

  int size() {
    return size;
  }

  int capacity() {
    return samples.length;
  }

  double[] sortedCopy() {
    // Until the buffer wraps the live samples occupy slots [0, size).
    double[] copy = Arrays.copyOf(samples, size);
    Arrays.sort(copy);
    return copy;
  }

  /**
   * Linear-interpolation percentile over sorted samples.
   *
   * @param sorted ascending samples
   * @param p percentile; {@code <= 0} yields the minimum and {@code >= 100} the maximum
   * @return percentile, or empty when there are no samples
   */
  static OptionalDouble percentile(double[] sorted, double p) {
    int n = sorted.length;
    if (n == 0) {
      return OptionalDouble.empty();
    }
    if (p <= 0) {
      return OptionalDouble.of(sorted[0]);
    }
    if (p >= 100) {
      return OptionalDouble.of(sorted[n - 1]);
    }
    double rank = (n - 1) * p / 100.0d;
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    double fraction = rank - lower;
    return OptionalDouble.of(sorted[lower] + (sorted[upper] - sorted[lower]) * fraction);
  }
}
