package ca.gc.cra.warper.application.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warper.domain.warp.FailureKind;
import ca.gc.cra.warper.domain.warp.Notification;
import ca.gc.cra.warper.domain.warp.OutputDescriptor;
import ca.gc.cra.warper.domain.warp.WorkResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultDrainTest {
  private final RecordingNotifier notifier = new RecordingNotifier();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final OutstandingCount outstanding = new OutstandingCount();
  private final ResultDrain drain = new ResultDrain(notifier, "warped", outstanding, metrics);

  @Test
  void publishesSuccessesAndDecrementsForEveryResult() {
    WorkDispatcher dispatcher = finishedDispatcher(item -> item.sourceUri().endsWith("bad.tif")
        ? WorkResult.failed(item, FailureKind.EXTERNAL_TOOL_ERROR)
        : WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath())),
        "/in/a.tif", "/in/bad.tif");

    List<WorkResult> drained = drain.drain(dispatcher);

    assertEquals(2, drained.size());
    assertEquals(0, outstanding.get());
    assertEquals(1, notifier.published.size());
    Notification notification = notifier.published.get(0);
    assertEquals("warped", notification.topic());
    assertEquals(Notification.FILE_TYPE, notification.type());
    assertEquals("/out/a.tif", notification.payload().get("uri"));
    assertEquals("a.tif", notification.payload().get("uid"));
    assertEquals("NOAA-20", notification.payload().get("platform_name"));
    assertEquals(1L, metrics.counter("warper.items.succeeded"));
    assertEquals(1L, metrics.counter("warper.items.failed"));
  }

  @Test
  void failedReprojectionPublishesNothingButStillDecrements() {
    WorkDispatcher dispatcher =
        finishedDispatcher(item -> WorkResult.failed(item, FailureKind.EXTERNAL_TOOL_ERROR), "/in/a.tif");

    drain.drain(dispatcher);

    assertTrue(notifier.published.isEmpty());
    assertEquals(0, outstanding.get());
  }

  @Test
  void secondDrainWithoutNewCompletionsIsEmpty() {
    WorkDispatcher dispatcher = finishedDispatcher(
        item -> WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath())), "/in/a.tif", "/in/b.tif");

    assertEquals(2, drain.drain(dispatcher).size());
    assertTrue(drain.drain(dispatcher).isEmpty());
    assertEquals(2, notifier.published.size());
  }

  @Test
  void notifierFailureIsAbsorbed() {
    notifier.failure = new IllegalStateException("broker down");
    WorkDispatcher dispatcher = finishedDispatcher(
        item -> WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath())), "/in/a.tif");

    List<WorkResult> drained = drain.drain(dispatcher);

    assertEquals(1, drained.size());
    assertEquals(0, outstanding.get());
    assertEquals(1L, metrics.counter("warper.notify.error"));
    assertEquals(0L, metrics.counter("warper.notify.published"));
  }

  private WorkDispatcher finishedDispatcher(WorkStep step, String... uris) {
    WorkDispatcher dispatcher = new WorkDispatcher(step, 1, metrics);
    for (String uri : uris) {
      assertTrue(dispatcher.submit(Items.item(uri)));
      outstanding.increment();
    }
    dispatcher.close();
    return dispatcher;
  }
}
