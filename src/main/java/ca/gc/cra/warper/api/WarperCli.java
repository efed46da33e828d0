package ca.gc.cra.warper.api;

import ca.gc.cra.warper.application.warp.ShutdownSignal;
import ca.gc.cra.warper.application.warp.WarperService;
import ca.gc.cra.warper.config.CompositionRoot;
import ca.gc.cra.warper.config.WarperConfig;
import ca.gc.cra.warper.config.WarperConfigLoader;
import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warper.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the reprojection service until a termination signal has been honoured.
 *
 * @since WARPER 0.1
 */
public final class WarperCli {
  private static final Logger log = LoggerFactory.getLogger(WarperCli.class);
  private static final String SUMMARY_USAGE =
      "usage: warper config=PATH [projection=NAME] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      WARPER raster reprojection service

      Usage:
        warper config=PATH [options]

      Options:
        config=PATH                 YAML configuration file (required)
        projection=NAME             Projection used when the file has no target_projection
        metricsExporter=otlp|none   OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL            OTLP endpoint (default http://localhost:4317)
        --dry-run                   Validate configuration and print the plan without subscribing
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Notes:
        SIGTERM or SIGINT stops new submissions; outstanding reprojections finish and are announced first.
      """;

  private WarperCli() {}

  /**
   * Parses arguments, loads configuration and runs the service.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printLines(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for warper CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Path configPath;
    Optional<String> projection;
    try {
      List<String> unknownFlags = new ArrayList<>(input.flags());
      unknownFlags.removeAll(List.of("--help", "--verbose", "--dry-run"));
      if (!unknownFlags.isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + String.join(", ", unknownFlags));
      }
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      String rawConfig = kv.remove("config");
      if (rawConfig == null) {
        throw new IllegalArgumentException("config=PATH is required");
      }
      configPath = Path.of(rawConfig);
      projection = Optional.ofNullable(kv.remove("projection"));
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", kv.keySet()));
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    WarperConfig config;
    try {
      config = WarperConfigLoader.load(configPath, projection);
    } catch (IOException ex) {
      log.error("Unable to read configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return runService(config);
  }

  private static ExitCode runService(WarperConfig config) {
    ShutdownSignal shutdown = new ShutdownSignal();
    CountDownLatch finished = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(shutdownHook(shutdown, finished, config.shutdownGrace()));
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      try (WarperService service = root.warperService(shutdown)) {
        log.info(
            "Starting warper: projection={}, workers={}, subscribe={}@{}, publish={}@{}",
            config.targetProjection(),
            config.numWorkers(),
            config.subscriber().topic(),
            config.subscriber().bootstrap(),
            config.publisher().topic(),
            config.publisher().bootstrap());
        service.run();
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Warper configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      if (Thread.currentThread().isInterrupted()) {
        log.error("Warper interrupted; shutting down", ex);
        return ExitCode.INTERRUPTED;
      }
      log.error("Unexpected runtime failure in warper", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
    }
  }

  static Thread shutdownHook(ShutdownSignal shutdown, CountDownLatch finished, Optional<Duration> grace) {
    return new Thread(() -> {
      if (shutdown.request()) {
        log.info("Termination requested; finishing outstanding work");
      }
      try {
        if (grace.isPresent()) {
          if (!finished.await(grace.get().toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Shutdown grace period {} elapsed before outstanding work drained", grace.get());
          }
        } else {
          finished.await();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "warper-shutdown");
  }

  private static void printDryRunPlan(WarperConfig config) {
    List<String> options = new ArrayList<>();
    for (ToolOption option : config.projectionOptions()) {
      options.add(String.join(" ", option.toArguments()));
    }
    CliPrinter.printLines(
        "Warper dry-run: no subscription will be opened.",
        " Target directory : " + config.targetDir(),
        " Projection       : " + config.targetProjection() + " " + options,
        " Overviews        : " + (config.overviews().isEmpty() ? "<none>" : config.overviews()),
        " Tools            : " + config.warpCommand() + ", " + config.overviewCommand(),
        " Workers          : " + config.numWorkers(),
        " Queue            : " + (config.queueCapacity() == 0 ? "unbounded" : config.queueCapacity())
            + " (" + config.queuePolicy() + ")",
        " Restart timeout  : " + config.restartTimeout().map(Duration::toString).orElse("<disabled>"),
        " Command timeout  : " + config.commandTimeout().map(Duration::toString).orElse("<none>"),
        " Subscribe        : " + config.subscriber().topic() + " @ " + config.subscriber().bootstrap(),
        " Publish          : " + config.publisher().topic() + " @ " + config.publisher().bootstrap(),
        " Re-run without --dry-run to start processing.");
  }
}
