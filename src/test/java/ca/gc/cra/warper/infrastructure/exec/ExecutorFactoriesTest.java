package ca.gc.cra.warper.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void workersAreNamedNonDaemonThreads() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newWorkerPool(2, "warp-test", 0, QueuePolicy.BLOCK, null);
    AtomicReference<Thread> worker = new AtomicReference<>();
    CountDownLatch ran = new CountDownLatch(1);
    try {
      pool.execute(() -> {
        worker.set(Thread.currentThread());
        ran.countDown();
      });
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertTrue(worker.get().getName().startsWith("warp-test-"));
      assertFalse(worker.get().isDaemon());
      assertTrue(pool.getQueue() instanceof LinkedBlockingQueue);
      assertEquals(2, pool.getMaximumPoolSize());
    } finally {
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  @Test
  void blockPolicyWaitsForQueueSpace() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newWorkerPool(1, null, 1, QueuePolicy.BLOCK, null);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch submittedThird = new CountDownLatch(1);
    try {
      assertTrue(pool.getQueue() instanceof ArrayBlockingQueue);
      pool.execute(() -> awaitQuietly(release));
      pool.execute(() -> {});
      Thread submitter = new Thread(() -> {
        pool.execute(() -> {});
        submittedThird.countDown();
      });
      submitter.start();

      assertFalse(submittedThird.await(200, TimeUnit.MILLISECONDS), "submitter should block while queue is full");
      release.countDown();
      assertTrue(submittedThird.await(5, TimeUnit.SECONDS));
      submitter.join(5_000);
    } finally {
      release.countDown();
      pool.shutdown();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  @Test
  void rejectsInvalidSizes() {
    assertThrows(IllegalArgumentException.class,
        () -> ExecutorFactories.newWorkerPool(0, "x", 0, QueuePolicy.BLOCK, null));
    assertThrows(IllegalArgumentException.class,
        () -> ExecutorFactories.newWorkerPool(1, "x", -1, QueuePolicy.BLOCK, null));
  }

  @Test
  void queuePolicyParsesCaseInsensitively() {
    assertEquals(QueuePolicy.BLOCK, QueuePolicy.fromString(null));
    assertEquals(QueuePolicy.REJECT, QueuePolicy.fromString(" reject "));
    assertThrows(IllegalArgumentException.class, () -> QueuePolicy.fromString("drop"));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
