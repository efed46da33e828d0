/**
 * Executor factories for the reprojection worker pool.
 * <p><strong>Role:</strong> Infrastructure utilities configuring fixed-size pools with a bounded or unbounded
 * hand-off queue.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Performance:</strong> Names worker threads ({@code warper-worker-N}) for diagnostics.</p>
 * <p><strong>Metrics:</strong> Workers emit metrics via configured {@link ca.gc.cra.warper.application.port.MetricsPort}
 * observers.</p>
 */
package ca.gc.cra.warper.infrastructure.exec;
