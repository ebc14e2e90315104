package ca.gc.cra.clipstitch.application.port;

/**
 * <strong>What:</strong> Domain port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the engines record counters and latency observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from parallel engine calls.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code cut.samples.dropped}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code cut.clips.produced}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds {@code delta} to the named counter.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param delta non-negative increment
   */
  default void add(String key, long delta) {
    for (long i = 0; i < delta; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
