package ca.gc.cra.warper.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating tuned executor services aligned with WARPER concurrency requirements.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for reprojection workers.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param queueCapacity capacity of the hand-off queue; {@code 0} means unbounded
   * @param policy behaviour when a bounded queue is full
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newWorkerPool(
      int size, String prefix, int queueCapacity, QueuePolicy policy, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity < 0) {
      throw new IllegalArgumentException("queueCapacity must not be negative");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "warper-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    BlockingQueue<Runnable> queue =
        queueCapacity == 0 ? new LinkedBlockingQueue<>() : new ArrayBlockingQueue<>(queueCapacity);
    RejectedExecutionHandler rejection =
        Objects.requireNonNullElse(policy, QueuePolicy.BLOCK) == QueuePolicy.BLOCK
            ? new BlockWhenFull()
            : new ThreadPoolExecutor.AbortPolicy();

    return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, queue, factory, rejection);
  }

  private static final class BlockWhenFull implements RejectedExecutionHandler {
    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
      if (executor.isShutdown()) {
        throw new RejectedExecutionException("Worker pool is shut down");
      }
      try {
        executor.getQueue().put(task);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new RejectedExecutionException("Interrupted while waiting for worker queue space", ex);
      }
    }
  }
}
