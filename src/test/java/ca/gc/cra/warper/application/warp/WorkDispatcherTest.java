package ca.gc.cra.warper.application.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warper.domain.warp.FailureKind;
import ca.gc.cra.warper.domain.warp.OutputDescriptor;
import ca.gc.cra.warper.domain.warp.WorkResult;
import ca.gc.cra.warper.infrastructure.exec.QueuePolicy;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class WorkDispatcherTest {
  private static final Duration WAIT = Duration.ofSeconds(10);

  @Test
  void neverRunsMoreStepsThanWorkers() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    WorkStep instrumented = item -> {
      int now = active.incrementAndGet();
      maxActive.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(20);
      } finally {
        active.decrementAndGet();
      }
      return WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath()));
    };
    RecordingMetrics metrics = new RecordingMetrics();
    WorkDispatcher dispatcher = new WorkDispatcher(instrumented, 3, metrics);
    try {
      for (int i = 0; i < 12; i++) {
        assertTrue(dispatcher.submit(Items.item("/in/" + i + ".tif")));
      }
      List<WorkResult> results = Items.awaitResults(dispatcher, 12, WAIT);
      assertEquals(12, results.size());
      assertTrue(maxActive.get() <= 3, "max concurrency was " + maxActive.get());
    } finally {
      dispatcher.close();
    }
  }

  @Test
  void queuesSubmissionsBeyondThePoolSize() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(2);
    WorkStep gated = item -> {
      started.countDown();
      release.await();
      return WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath()));
    };
    WorkDispatcher dispatcher = new WorkDispatcher(gated, 2, new RecordingMetrics());
    try {
      assertTrue(dispatcher.submit(Items.item("/in/a.tif")));
      assertTrue(dispatcher.submit(Items.item("/in/b.tif")));
      assertTrue(dispatcher.submit(Items.item("/in/c.tif")), "third submission must be queued, not dropped");
      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertTrue(dispatcher.drainCompleted().isEmpty());

      release.countDown();
      List<WorkResult> results = Items.awaitResults(dispatcher, 3, WAIT);

      Set<String> uris = results.stream().map(r -> r.item().sourceUri()).collect(Collectors.toSet());
      assertEquals(Set.of("/in/a.tif", "/in/b.tif", "/in/c.tif"), uris);
    } finally {
      dispatcher.close();
    }
  }

  @Test
  void crashingStepStillYieldsAResult() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    WorkStep crashing = item -> {
      throw new IllegalStateException("worker blew up");
    };
    WorkDispatcher dispatcher = new WorkDispatcher(crashing, 1, metrics);
    try {
      assertTrue(dispatcher.submit(Items.item("/in/a.tif")));
      List<WorkResult> results = Items.awaitResults(dispatcher, 1, WAIT);

      assertEquals(1, results.size());
      assertEquals(FailureKind.WORKER_CRASH, results.get(0).failure().orElseThrow());
      assertEquals(1L, metrics.counter("warper.worker.crash"));
    } finally {
      dispatcher.close();
    }
  }

  @Test
  void rejectPolicyRefusesWorkWhenQueueIsFull() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    WorkStep gated = item -> {
      started.countDown();
      release.await();
      return WorkResult.failed(item, FailureKind.EXTERNAL_TOOL_ERROR);
    };
    RecordingMetrics metrics = new RecordingMetrics();
    WorkDispatcher dispatcher =
        new WorkDispatcher(gated, 1, 1, QueuePolicy.REJECT, metrics, Duration.ofSeconds(5));
    try {
      assertTrue(dispatcher.submit(Items.item("/in/a.tif")));
      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertTrue(dispatcher.submit(Items.item("/in/b.tif")));
      assertFalse(dispatcher.submit(Items.item("/in/c.tif")));
      assertEquals(1L, metrics.counter("warper.items.rejected"));

      release.countDown();
      assertEquals(2, Items.awaitResults(dispatcher, 2, WAIT).size());
    } finally {
      dispatcher.close();
    }
  }

  @Test
  void closeWaitsForRunningWorkAndRefusesNewSubmissions() throws Exception {
    WorkStep slow = item -> {
      Thread.sleep(50);
      return WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath()));
    };
    WorkDispatcher dispatcher = new WorkDispatcher(slow, 1, new RecordingMetrics());
    assertTrue(dispatcher.submit(Items.item("/in/a.tif")));

    dispatcher.close();

    assertEquals(1, dispatcher.drainCompleted().size());
    assertFalse(dispatcher.submit(Items.item("/in/b.tif")));
  }
}
