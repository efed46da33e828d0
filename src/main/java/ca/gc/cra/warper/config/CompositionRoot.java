package ca.gc.cra.warper.config;

import ca.gc.cra.warper.adapter.kafka.KafkaEventSource;
import ca.gc.cra.warper.adapter.kafka.KafkaNotifier;
import ca.gc.cra.warper.application.port.ClockPort;
import ca.gc.cra.warper.application.port.CommandRunner;
import ca.gc.cra.warper.application.port.EventSource;
import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.application.warp.LoopSettings;
import ca.gc.cra.warper.application.warp.ReprojectionStep;
import ca.gc.cra.warper.application.warp.ShutdownSignal;
import ca.gc.cra.warper.application.warp.WarpCommandBuilder;
import ca.gc.cra.warper.application.warp.WarperService;
import ca.gc.cra.warper.application.warp.WorkDispatcher;
import ca.gc.cra.warper.application.warp.WorkItemFactory;
import ca.gc.cra.warper.infrastructure.process.ProcessCommandRunner;
import ca.gc.cra.warper.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root that wires a {@link WarperService} from a {@link WarperConfig}.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI only deals with configuration and
 * lifecycle.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning subscribe -> reproject -> notify.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances and are
 * invoked during start-up only.</p>
 *
 * @since WARPER 0.1
 */
public final class CompositionRoot {
  private static final Duration WORKER_CLOSE_TIMEOUT = Duration.ofMinutes(10);

  private final WarperConfig config;
  private final MetricsPort metrics;

  /**
   * @param config validated configuration; must not be {@code null}
   * @param metrics metrics sink shared by all components; must not be {@code null}
   */
  public CompositionRoot(WarperConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** @return wall clock used for idle detection */
  public ClockPort clock() {
    return new SystemClockAdapter();
  }

  /** @return external process runner honouring {@code command_timeout} */
  public CommandRunner commandRunner() {
    return new ProcessCommandRunner(config.commandTimeout());
  }

  /** @return argument builder for the configured tools */
  public WarpCommandBuilder commandBuilder() {
    return new WarpCommandBuilder(config.warpCommand(), config.overviewCommand());
  }

  /** @return payload converter bound to the selected projection */
  public WorkItemFactory workItemFactory() {
    return new WorkItemFactory(config.targetDir(), config.projectionOptions(), config.overviews());
  }

  /** @return worker pool running {@link ReprojectionStep}s */
  public WorkDispatcher workDispatcher() {
    ReprojectionStep step = new ReprojectionStep(commandRunner(), commandBuilder(), metrics);
    return new WorkDispatcher(
        step,
        config.numWorkers(),
        config.queueCapacity(),
        config.queuePolicy(),
        metrics,
        WORKER_CLOSE_TIMEOUT);
  }

  /** @return Kafka event source for the subscriber settings */
  public EventSource eventSource() {
    WarperConfig.SubscriberSettings subscriber = config.subscriber();
    return new KafkaEventSource(
        subscriber.bootstrap(),
        subscriber.topic(),
        subscriber.groupId().orElse(null),
        subscriber.autoOffsetReset());
  }

  /** @return Kafka notifier for the publisher settings */
  public Notifier notifier() {
    return new KafkaNotifier(config.publisher().bootstrap());
  }

  /** @return loop settings derived from configuration */
  public LoopSettings loopSettings() {
    return LoopSettings.of(config.publisher().topic(), config.restartTimeout());
  }

  /**
   * Wires the full service.
   *
   * @param shutdown termination flag shared with the signal handler
   * @return service owning the worker pool and notifier
   */
  public WarperService warperService(ShutdownSignal shutdown) {
    WorkDispatcher dispatcher = workDispatcher();
    try {
      return new WarperService(
          eventSource(),
          dispatcher,
          workItemFactory(),
          notifier(),
          Objects.requireNonNull(shutdown, "shutdown"),
          clock(),
          metrics,
          loopSettings());
    } catch (RuntimeException ex) {
      dispatcher.close();
      throw ex;
    }
  }
}
