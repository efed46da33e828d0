package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.ClockPort;
import ca.gc.cra.warper.application.port.EventSource;
import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.domain.warp.LoopOutcome;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-lifetime driver that re-enters a fresh {@link EventLoop} after every idle
 * restart.
 * <p><strong>Why:</strong> Recycles the subscription connection while keeping the worker pool and notifier
 * alive.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} must be called from a single thread; the
 * {@link ShutdownSignal} may be set from any thread.</p>
 *
 * @since WARPER 0.1
 */
public final class WarperService implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WarperService.class);

  private final EventSource source;
  private final WorkDispatcher dispatcher;
  private final WorkItemFactory items;
  private final Notifier notifier;
  private final ShutdownSignal shutdown;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final LoopSettings settings;

  /**
   * @param source inbound event source
   * @param dispatcher worker pool; closed by {@link #close()}
   * @param items payload to work item conversion
   * @param notifier completion publisher; closed by {@link #close()}
   * @param shutdown termination request flag
   * @param clock wall clock
   * @param metrics metrics sink
   * @param settings loop tunables
   */
  public WarperService(
      EventSource source,
      WorkDispatcher dispatcher,
      WorkItemFactory items,
      Notifier notifier,
      ShutdownSignal shutdown,
      ClockPort clock,
      MetricsPort metrics,
      LoopSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.items = Objects.requireNonNull(items, "items");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Runs loops until one returns {@link LoopOutcome#TERMINATE}.
   *
   * @return number of subscriptions opened
   */
  public int run() {
    int subscriptions = 0;
    while (true) {
      subscriptions++;
      EventLoop loop = new EventLoop(source, dispatcher, items, notifier, shutdown, clock, metrics, settings);
      LoopOutcome outcome = loop.run();
      if (outcome == LoopOutcome.TERMINATE) {
        log.info("Warper stopped after {} subscription(s)", subscriptions);
        return subscriptions;
      }
      metrics.increment("warper.loop.restart");
      log.info("Resubscribing after idle timeout");
    }
  }

  /** Waits for running work and releases the notifier. */
  @Override
  public void close() {
    try {
      dispatcher.close();
    } finally {
      notifier.close();
    }
  }
}
