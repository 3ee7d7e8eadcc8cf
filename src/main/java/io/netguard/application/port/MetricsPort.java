package io.netguard.application.port;

/**
 * <strong>What:</strong> Port abstracting NetGuard metrics emission.
 * <p><strong>Why:</strong> Lets the sampler, pipeline and enforcement stages record counters and latency observations
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from sampler, lane and
 * proxy threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pipeline.lane.dropped},
 * {@code enforce.reconcile.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code sampler.connections.opened}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
