package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.domain.warp.WorkItem;
import ca.gc.cra.warper.validation.Strings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the argument vectors for the reprojection and overview tools.
 * <p>Options are emitted in configuration order. A repeated option contributes one {@code -flag value}
 * pair per value; a token option contributes {@code -flag} followed by its whitespace-separated tokens.</p>
 *
 * @since WARPER 0.1
 */
public final class WarpCommandBuilder {
  private final String warpTool;
  private final String overviewTool;

  /**
   * @param warpTool reprojection executable (for example {@code gdalwarp})
   * @param overviewTool overview executable (for example {@code gdaladdo})
   */
  public WarpCommandBuilder(String warpTool, String overviewTool) {
    this.warpTool = Strings.requireNonBlank("warpTool", warpTool);
    this.overviewTool = Strings.requireNonBlank("overviewTool", overviewTool);
  }

  /**
   * @param item work item to reproject
   * @return {@code tool [options...] source target}
   */
  public List<String> warpCommand(WorkItem item) {
    Objects.requireNonNull(item, "item");
    List<String> argv = new ArrayList<>();
    argv.add(warpTool);
    for (ToolOption option : item.options()) {
      argv.addAll(option.toArguments());
    }
    argv.add(item.sourceUri());
    argv.add(item.targetPath().toString());
    return List.copyOf(argv);
  }

  /**
   * @param target reprojected file
   * @param levels overview levels, in order
   * @return {@code tool target level...}
   */
  public List<String> overviewCommand(Path target, List<Integer> levels) {
    Objects.requireNonNull(target, "target");
    List<String> argv = new ArrayList<>(levels.size() + 2);
    argv.add(overviewTool);
    argv.add(target.toString());
    for (Integer level : levels) {
      argv.add(String.valueOf(level));
    }
    return List.copyOf(argv);
  }
}
