package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.domain.warp.WorkItem;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns inbound payloads into {@link WorkItem}s using the configured projection.
 *
 * @since WARPER 0.1
 */
public final class WorkItemFactory {
  private static final Logger log = LoggerFactory.getLogger(WorkItemFactory.class);

  private final Path targetDir;
  private final List<ToolOption> options;
  private final List<Integer> overviews;

  /**
   * @param targetDir output directory
   * @param options projection options, in order
   * @param overviews overview levels; empty to skip overviews
   */
  public WorkItemFactory(Path targetDir, List<ToolOption> options, List<Integer> overviews) {
    this.targetDir = Objects.requireNonNull(targetDir, "targetDir");
    this.options = List.copyOf(options);
    this.overviews = List.copyOf(overviews);
  }

  /**
   * @param payload inbound message payload
   * @return work item, or empty when the payload carries no usable {@code uri}
   */
  public Optional<WorkItem> fromPayload(Map<String, Object> payload) {
    Objects.requireNonNull(payload, "payload");
    Object uri = payload.get("uri");
    if (!(uri instanceof String source) || source.isBlank() || source.endsWith("/")) {
      log.warn("Skipping event without a usable uri (keys={})", payload.keySet());
      return Optional.empty();
    }
    return Optional.of(new WorkItem(source, targetDir, options, overviews, payload));
  }
}
