package ca.gc.cra.dem.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the resolver, binner and uncertainty estimator count skips and time phases
 * without binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from worker pools.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code catalog.entries.skipped}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code catalog.entries.pruned}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value such as nanoseconds or point counts
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
