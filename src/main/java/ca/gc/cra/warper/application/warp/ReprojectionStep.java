package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.CommandRunner;
import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.domain.warp.CommandResult;
import ca.gc.cra.warper.domain.warp.FailureKind;
import ca.gc.cra.warper.domain.warp.OutputDescriptor;
import ca.gc.cra.warper.domain.warp.WorkItem;
import ca.gc.cra.warper.domain.warp.WorkResult;
import ca.gc.cra.warper.logging.Logs;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reprojects one input file and optionally builds its overviews.
 * <p><strong>Why:</strong> Keeps the two external invocations and their failure semantics in one place so
 * workers only see a {@link WorkResult}.</p>
 * <p><strong>Role:</strong> {@link WorkStep} executed on {@link WorkDispatcher} worker threads.</p>
 * <p><strong>Failure semantics:</strong>
 * <ul>
 *   <li>A failed reprojection skips the overview step and yields a result without output.</li>
 *   <li>A failed overview step yields {@link FailureKind#OVERVIEW_GENERATION_ERROR}; the reprojected file
 *   is left on disk and is not announced.</li>
 *   <li>An empty overview list is a successful no-op.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to share across workers
 * when the {@link CommandRunner} and {@link MetricsPort} are.</p>
 * <p><strong>Observability:</strong> Places the source URI in the MDC key {@value #MDC_URI} and records
 * {@code warper.command.latencyNanos}.</p>
 *
 * @since WARPER 0.1
 */
public final class ReprojectionStep implements WorkStep {
  /** MDC key carrying the source URI while a step runs. */
  public static final String MDC_URI = "warper.uri";
  private static final Logger log = LoggerFactory.getLogger(ReprojectionStep.class);

  private final CommandRunner runner;
  private final WarpCommandBuilder commands;
  private final MetricsPort metrics;

  /**
   * @param runner external process runner
   * @param commands argument vector builder
   * @param metrics metrics sink
   */
  public ReprojectionStep(CommandRunner runner, WarpCommandBuilder commands, MetricsPort metrics) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.commands = Objects.requireNonNull(commands, "commands");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public WorkResult execute(WorkItem item) throws InterruptedException {
    Objects.requireNonNull(item, "item");
    String previous = MDC.get(MDC_URI);
    MDC.put(MDC_URI, item.sourceUri());
    try {
      Path target = item.targetPath();
      CommandResult warped = run(commands.warpCommand(item));
      if (!warped.ok()) {
        log.error("Reprojection of {} failed: {}", item.sourceUri(), Logs.toolOutput(warped.message()));
        return WorkResult.failed(item, warped.failure().orElse(FailureKind.EXTERNAL_TOOL_ERROR));
      }
      log.info(warped.message());

      if (!item.overviews().isEmpty()) {
        CommandResult overviews = run(commands.overviewCommand(target, item.overviews()));
        if (!overviews.ok()) {
          log.error(
              "Overview generation for {} failed; reprojected file left in place: {}",
              target,
              Logs.toolOutput(overviews.message()));
          return WorkResult.failed(item, FailureKind.OVERVIEW_GENERATION_ERROR);
        }
        log.debug("Overviews {} added to {}", item.overviews(), target);
      }
      return WorkResult.succeeded(item, OutputDescriptor.forPath(target));
    } finally {
      if (previous == null) {
        MDC.remove(MDC_URI);
      } else {
        MDC.put(MDC_URI, previous);
      }
    }
  }

  private CommandResult run(List<String> argv) throws InterruptedException {
    log.debug("Running {}", argv);
    CommandResult result = runner.run(argv);
    metrics.observe("warper.command.latencyNanos", result.elapsed().toNanos());
    return result;
  }
}
