package ca.gc.cra.warper.application.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warper.domain.warp.OutputDescriptor;
import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.domain.warp.WorkResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WarperServiceTest {
  @Test
  void resubscribesAfterIdleTimeoutAndStopsOnShutdown() {
    RecordingMetrics metrics = new RecordingMetrics();
    RecordingNotifier notifier = new RecordingNotifier();
    ShutdownSignal shutdown = new ShutdownSignal();
    MutableClock clock = new MutableClock();
    ScriptedEventSource source = new ScriptedEventSource(subscription -> {
      if (subscription == 1) {
        clock.advance(Duration.ofMinutes(2));
      } else {
        shutdown.request();
      }
    });
    WorkDispatcher dispatcher = new WorkDispatcher(
        item -> WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath())), 1, metrics);
    WarperService service = new WarperService(
        source,
        dispatcher,
        new WorkItemFactory(Path.of("/out"), List.of(ToolOption.tokens("t_srs", "EPSG:4326")), List.of()),
        notifier,
        shutdown,
        clock,
        metrics,
        new LoopSettings("warped", Optional.of(Duration.ofMinutes(1)), Duration.ofMillis(1)));

    int subscriptions;
    try (service) {
      subscriptions = service.run();
    }

    assertEquals(2, subscriptions);
    assertEquals(2, source.closed);
    assertEquals(1L, metrics.counter("warper.loop.restart"));
    assertTrue(notifier.closed);
  }
}
