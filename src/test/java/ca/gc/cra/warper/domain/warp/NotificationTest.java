package ca.gc.cra.warper.domain.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NotificationTest {
  @Test
  void replacesUriAndAddsUidWithoutTouchingTheInboundPayload() {
    Map<String, Object> inbound = new HashMap<>();
    inbound.put("uri", "/in/a.tif");
    inbound.put("sensor", "viirs");
    inbound.put("orbit", null);
    WorkItem item = new WorkItem("/in/a.tif", Path.of("/out"), List.of(), List.of(), inbound);
    WorkResult result = WorkResult.succeeded(item, OutputDescriptor.forPath(item.targetPath()));

    Notification notification = Notification.forResult("warped", result);

    assertEquals("/out/a.tif", notification.payload().get("uri"));
    assertEquals("a.tif", notification.uid());
    assertEquals("viirs", notification.payload().get("sensor"));
    assertEquals("/in/a.tif", item.payload().get("uri"));
    assertEquals(Notification.FILE_TYPE, notification.type());
  }

  @Test
  void failedResultsCannotBeAnnounced() {
    WorkItem item = new WorkItem("/in/a.tif", Path.of("/out"), List.of(), List.of(), Map.of());
    WorkResult failed = WorkResult.failed(item, FailureKind.EXTERNAL_TOOL_ERROR);

    assertThrows(IllegalArgumentException.class, () -> Notification.forResult("warped", failed));
  }

  @Test
  void targetPathUsesTheSourceBaseName() {
    WorkItem item = new WorkItem("file:///data/in/scene_01.tif", Path.of("/out"), List.of(), List.of(), Map.of());

    assertEquals(Path.of("/out/scene_01.tif"), item.targetPath());
  }
}
