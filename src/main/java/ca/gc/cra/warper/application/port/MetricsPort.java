package ca.gc.cra.warper.application.port;

/**
 * <strong>What:</strong> Port abstracting WARPER metrics emission.
 * <p><strong>Why:</strong> Allows the loop and workers to record counters and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the control
 * thread and worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code warper.command.latencyNanos}).</p>
 *
 * @since WARPER 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code warper.items.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);
}
