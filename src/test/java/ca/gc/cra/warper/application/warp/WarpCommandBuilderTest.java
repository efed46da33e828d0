package ca.gc.cra.warper.application.warp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.domain.warp.WorkItem;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WarpCommandBuilderTest {
  private final WarpCommandBuilder builder = new WarpCommandBuilder("gdalwarp", "gdaladdo");

  @Test
  void listOptionsRepeatTheFlagOncePerValueInOrder() {
    List<String> values = List.of("COMPRESS=DEFLATE", "TILED=YES", "BLOCKXSIZE=512", "BLOCKYSIZE=512");
    WorkItem item = new WorkItem(
        "/in/scene.tif",
        Path.of("/out"),
        List.of(ToolOption.repeated("co", values), ToolOption.repeated("wo", List.of("NUM_THREADS=2"))),
        List.of(),
        Map.of());

    List<String> argv = builder.warpCommand(item);

    assertEquals(
        List.of(
            "gdalwarp",
            "-co", "COMPRESS=DEFLATE",
            "-co", "TILED=YES",
            "-co", "BLOCKXSIZE=512",
            "-co", "BLOCKYSIZE=512",
            "-wo", "NUM_THREADS=2",
            "/in/scene.tif",
            "/out/scene.tif"),
        argv);
    assertEquals(values.size(), Collections.frequency(argv, "-co"));
  }

  @Test
  void stringOptionsAreSplitOnWhitespace() {
    WorkItem item = new WorkItem(
        "/in/a.tif",
        Path.of("/out"),
        List.of(ToolOption.tokens("tr", " 1000   1000 "), ToolOption.tokens("t_srs", "EPSG:4326")),
        List.of(),
        Map.of());

    assertEquals(
        List.of("gdalwarp", "-tr", "1000", "1000", "-t_srs", "EPSG:4326", "/in/a.tif", "/out/a.tif"),
        builder.warpCommand(item));
  }

  @Test
  void overviewCommandListsTargetThenLevels() {
    assertEquals(
        List.of("gdaladdo", "/out/a.tif", "2", "4", "8"),
        builder.overviewCommand(Path.of("/out/a.tif"), List.of(2, 4, 8)));
  }

  @Test
  void blankToolNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new WarpCommandBuilder(" ", "gdaladdo"));
  }
}
