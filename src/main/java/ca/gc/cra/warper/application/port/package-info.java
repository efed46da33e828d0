/**
 * Ports connecting the dispatch loop to external collaborators: the process runner, the
 * subscription, the notifier, clocks, and metrics.
 * <p><strong>Role:</strong> Application boundary implemented by {@code ca.gc.cra.warper.adapter} and
 * {@code ca.gc.cra.warper.infrastructure} packages.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.warper.application.port.CommandRunner} and
 * {@link ca.gc.cra.warper.application.port.MetricsPort} are called from worker threads; subscriptions and
 * notifiers only from the control thread.</p>
 */
package ca.gc.cra.warper.application.port;
