package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.ClockPort;
import ca.gc.cra.warper.application.port.EventSource;
import ca.gc.cra.warper.application.port.EventSubscription;
import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.domain.warp.InboundEvent;
import ca.gc.cra.warper.domain.warp.LoopOutcome;
import ca.gc.cra.warper.domain.warp.WorkItem;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One subscription lifetime of the dispatch loop.
 * <p><strong>Why:</strong> Separates the idle-restart path from the termination path with an explicit
 * {@link LoopOutcome}, so the enclosing service decides whether to resubscribe or stop.</p>
 * <p><strong>Role:</strong> Control-thread driver: receive, drain, decide, submit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drain finished results before looking at each event or poll tick.</li>
 *   <li>Return {@link LoopOutcome#TERMINATE} once shutdown is requested and nothing is outstanding.</li>
 *   <li>Return {@link LoopOutcome#CONTINUE_SUBSCRIPTION} when idle longer than the restart timeout with
 *   nothing outstanding.</li>
 *   <li>Stop submitting new payloads while draining after a shutdown request.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the control thread. The only cross-thread input is the
 * {@link ShutdownSignal}.</p>
 * <p><strong>Observability:</strong> Emits {@code warper.events.*}, {@code warper.items.submitted} and the
 * {@code warper.outstanding} histogram.</p>
 *
 * @since WARPER 0.1
 */
public final class EventLoop {
  private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

  /** Lifecycle state of a loop run. */
  public enum State {
    /** Accepting and submitting new events. */
    RUNNING,
    /** Shutdown requested; finishing outstanding work without submitting more. */
    DRAINING,
    /** Loop has returned an outcome. */
    STOPPED
  }

  private final EventSource source;
  private final WorkDispatcher dispatcher;
  private final WorkItemFactory items;
  private final ShutdownSignal shutdown;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final LoopSettings settings;
  private final OutstandingCount outstanding = new OutstandingCount();
  private final ResultDrain drain;

  private State state = State.RUNNING;
  private long lastEventMillis;

  /**
   * @param source inbound event source; subscribed once per {@link #run()}
   * @param dispatcher worker pool receiving work items
   * @param items payload to work item conversion
   * @param notifier completion publisher
   * @param shutdown termination request flag
   * @param clock wall clock used for idle detection
   * @param metrics metrics sink
   * @param settings loop tunables
   */
  public EventLoop(
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
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.drain = new ResultDrain(notifier, settings.notificationTopic(), outstanding, metrics);
    this.lastEventMillis = clock.nowMillis();
  }

  /**
   * Subscribes and processes events until the loop decides to stop.
   *
   * @return {@link LoopOutcome#CONTINUE_SUBSCRIPTION} after an idle timeout, {@link LoopOutcome#TERMINATE} after a
   *     shutdown request once all outstanding work has drained
   */
  public LoopOutcome run() {
    if (state == State.STOPPED) {
      throw new IllegalStateException("event loop already stopped");
    }
    lastEventMillis = clock.nowMillis();
    try (EventSubscription subscription = source.subscribe()) {
      log.debug("Subscription opened");
      while (true) {
        InboundEvent event = subscription.next(settings.pollTimeout());
        Optional<LoopOutcome> outcome = handle(event);
        if (outcome.isPresent()) {
          return outcome.get();
        }
      }
    }
  }

  /**
   * Processes one event or poll tick.
   *
   * @param event received event; a heartbeat for a poll tick
   * @return the outcome when the loop should stop, otherwise empty
   */
  Optional<LoopOutcome> handle(InboundEvent event) {
    drain.drain(dispatcher);
    metrics.observe("warper.outstanding", outstanding.get());

    if (outstanding.isZero()) {
      if (shutdown.isRequested()) {
        state = State.STOPPED;
        log.info("Shutdown requested and no work outstanding; stopping");
        return Optional.of(LoopOutcome.TERMINATE);
      }
      Optional<Duration> restartTimeout = settings.restartTimeout();
      if (restartTimeout.isPresent() && clock.nowMillis() - lastEventMillis > restartTimeout.get().toMillis()) {
        state = State.STOPPED;
        log.info("No events for more than {}; restarting subscription", restartTimeout.get());
        return Optional.of(LoopOutcome.CONTINUE_SUBSCRIPTION);
      }
    }

    if (state == State.RUNNING && shutdown.isRequested()) {
      state = State.DRAINING;
      log.info("Shutdown requested; draining {} outstanding items", outstanding.get());
    }

    if (event.isHeartbeat()) {
      metrics.increment("warper.events.heartbeat");
      return Optional.empty();
    }
    metrics.increment("warper.events.received");
    Map<String, Object> payload = event.payload().orElseThrow();
    if (state == State.DRAINING) {
      log.warn("Ignoring event for {} received while draining", payload.get("uri"));
      return Optional.empty();
    }

    lastEventMillis = clock.nowMillis();
    Optional<WorkItem> item = items.fromPayload(payload);
    if (item.isEmpty()) {
      metrics.increment("warper.events.invalid");
      return Optional.empty();
    }
    if (dispatcher.submit(item.get())) {
      outstanding.increment();
      metrics.increment("warper.items.submitted");
      log.debug("Submitted {} ({} outstanding)", item.get().sourceUri(), outstanding.get());
    }
    return Optional.empty();
  }

  /** @return current lifecycle state */
  public State state() {
    return state;
  }

  /** @return number of submitted items not yet drained */
  public int outstanding() {
    return outstanding.get();
  }
}
