package ca.gc.cra.hashmatch.application.port;

/**
 * <strong>What:</strong> Port abstracting pipeline metrics emission.
 * <p><strong>Why:</strong> Lets workers and the orchestrator record counters and observations without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every worker thread.</p>
 * <p><strong>Observability:</strong> Metric names use dotted lower-case keys such as
 * {@code match.candidates.hashed}.</p>
 *
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
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (nanoseconds, queue depth, ...); semantics defined by the caller
   */
  void observe(String key, long value);
}
