package ca.gc.cra.warper.domain.warp;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One file's reprojection request together with the configuration it runs under.
 * <p><strong>Why:</strong> Captures everything a worker needs so it never touches shared configuration.</p>
 * <p><strong>Role:</strong> Domain value created by the event loop and consumed exactly once by a worker.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param sourceUri location of the input raster as announced by the inbound event
 * @param targetDir directory receiving the reprojected file
 * @param options ordered reprojection tool options for the selected projection
 * @param overviews ordered overview (pyramid) levels; empty disables overview generation
 * @param payload copy of the inbound event payload, republished on success
 * @since WARPER 0.1
 */
public record WorkItem(
    String sourceUri,
    Path targetDir,
    List<ToolOption> options,
    List<Integer> overviews,
    Map<String, Object> payload) {

  public WorkItem {
    Objects.requireNonNull(sourceUri, "sourceUri");
    Objects.requireNonNull(targetDir, "targetDir");
    options = List.copyOf(Objects.requireNonNull(options, "options"));
    overviews = List.copyOf(Objects.requireNonNull(overviews, "overviews"));
    // Map.copyOf rejects null values, which JSON payloads may legitimately carry.
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
  }

  /**
   * Returns the final path segment of the source location.
   *
   * @return file name of the source raster
   */
  public String sourceFileName() {
    int idx = sourceUri.lastIndexOf('/');
    return idx < 0 ? sourceUri : sourceUri.substring(idx + 1);
  }

  /**
   * Returns where the reprojected raster is written: {@code targetDir/sourceFileName}.
   *
   * @return output path
   */
  public Path targetPath() {
    return targetDir.resolve(sourceFileName());
  }
}
