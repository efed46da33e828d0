package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.domain.warp.FailureKind;
import ca.gc.cra.warper.domain.warp.WorkItem;
import ca.gc.cra.warper.domain.warp.WorkResult;
import ca.gc.cra.warper.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warper.infrastructure.exec.QueuePolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed-size worker pool that executes {@link WorkStep}s and hands results back through a
 * completion queue.
 * <p><strong>Why:</strong> Lets the control thread submit work and collect finished results without ever waiting
 * on a specific item.</p>
 * <p><strong>Role:</strong> Concurrency boundary between the {@link EventLoop} and external tool invocations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run at most {@code workers} steps concurrently; queue the rest according to the {@link QueuePolicy}.</li>
 *   <li>Publish exactly one {@link WorkResult} per accepted item, including when the step crashes.</li>
 *   <li>Stop accepting work on {@link #close()} and let running invocations finish.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit(WorkItem)} and {@link #drainCompleted()} are intended for the
 * single control thread; the completion queue is written concurrently by workers.</p>
 * <p><strong>Observability:</strong> Emits {@code warper.items.rejected} and {@code warper.worker.crash}.</p>
 *
 * @since WARPER 0.1
 */
public final class WorkDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WorkDispatcher.class);
  private static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofMinutes(10);
  private static final Duration FORCED_CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final WorkStep step;
  private final MetricsPort metrics;
  private final ThreadPoolExecutor executor;
  private final BlockingQueue<WorkResult> completed = new LinkedBlockingQueue<>();
  private final Duration closeTimeout;

  /**
   * Creates a dispatcher with an unbounded blocking queue.
   *
   * @param step work executed for every item
   * @param workers number of concurrent workers
   * @param metrics metrics sink
   */
  public WorkDispatcher(WorkStep step, int workers, MetricsPort metrics) {
    this(step, workers, 0, QueuePolicy.BLOCK, metrics, DEFAULT_CLOSE_TIMEOUT);
  }

  /**
   * Creates a dispatcher.
   *
   * @param step work executed for every item
   * @param workers number of concurrent workers; must be positive
   * @param queueCapacity pending-item capacity; {@code 0} means unbounded
   * @param policy behaviour when the bounded queue is full
   * @param metrics metrics sink
   * @param closeTimeout how long {@link #close()} waits for running work before interrupting it
   */
  public WorkDispatcher(
      WorkStep step,
      int workers,
      int queueCapacity,
      QueuePolicy policy,
      MetricsPort metrics,
      Duration closeTimeout) {
    this.step = Objects.requireNonNull(step, "step");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
    this.executor =
        ExecutorFactories.newWorkerPool(
            workers, "warper-worker", queueCapacity, Objects.requireNonNull(policy, "policy"), this::handleUncaught);
  }

  /**
   * Queues an item for execution and returns without waiting for its result.
   *
   * @param item item to process
   * @return {@code true} when accepted; {@code false} when refused by the queue policy or after {@link #close()}
   */
  public boolean submit(WorkItem item) {
    Objects.requireNonNull(item, "item");
    try {
      executor.execute(() -> runStep(item));
      return true;
    } catch (RejectedExecutionException ex) {
      metrics.increment("warper.items.rejected");
      log.warn("Work queue refused {}; item dropped", item.sourceUri());
      return false;
    }
  }

  /**
   * Returns every result currently available without waiting for more.
   *
   * @return finished results in completion order; empty when none are ready
   */
  public List<WorkResult> drainCompleted() {
    List<WorkResult> results = new ArrayList<>();
    completed.drainTo(results);
    return results;
  }

  /**
   * Stops accepting work and waits for running invocations to finish.
   */
  @Override
  public void close() {
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Workers active after {} ms; interrupting", closeTimeout.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(FORCED_CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Workers failed to terminate cleanly");
    }
  }

  private void runStep(WorkItem item) {
    WorkResult result = null;
    try {
      result = step.execute(item);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Processing of {} interrupted", item.sourceUri());
    } catch (RuntimeException ex) {
      metrics.increment("warper.worker.crash");
      log.error("Worker {} crashed while processing {}", Thread.currentThread().getName(), item.sourceUri(), ex);
    } finally {
      completed.add(result != null ? result : WorkResult.failed(item, FailureKind.WORKER_CRASH));
    }
  }

  private void handleUncaught(Thread thread, Throwable throwable) {
    metrics.increment("warper.worker.crash");
    log.error("Worker {} threw an uncaught exception", thread.getName(), throwable);
  }
}
