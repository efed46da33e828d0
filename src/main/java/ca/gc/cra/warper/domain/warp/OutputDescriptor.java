package ca.gc.cra.warper.domain.warp;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Location and identifier of a successfully reprojected raster.
 *
 * @param path output file path
 * @param uid derived identifier announced downstream (the output file name)
 * @since WARPER 0.1
 */
public record OutputDescriptor(Path path, String uid) {
  public OutputDescriptor {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(uid, "uid");
  }

  /**
   * Derives the descriptor for an output path, using its file name as identifier.
   *
   * @param path output file path
   * @return descriptor
   */
  public static OutputDescriptor forPath(Path path) {
    Path fileName = Objects.requireNonNull(path, "path").getFileName();
    return new OutputDescriptor(path, fileName == null ? path.toString() : fileName.toString());
  }

  /**
   * Returns the output location in the form placed in the {@code uri} field of notifications.
   *
   * @return output location
   */
  public String uri() {
    return path.toString();
  }
}
