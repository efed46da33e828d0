package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.MetricsPort;
import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.domain.warp.Notification;
import ca.gc.cra.warper.domain.warp.WorkResult;
import ca.gc.cra.warper.validation.Strings;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects finished results and announces the successful ones.
 * <p>Each drained result decrements the {@link OutstandingCount}; only results with an output descriptor are
 * published. Notifier failures are logged and absorbed so the control thread keeps running.</p>
 *
 * @since WARPER 0.1
 */
public final class ResultDrain {
  private static final Logger log = LoggerFactory.getLogger(ResultDrain.class);

  private final Notifier notifier;
  private final String topic;
  private final OutstandingCount outstanding;
  private final MetricsPort metrics;

  /**
   * @param notifier completion publisher
   * @param topic notification topic
   * @param outstanding counter owned by the calling loop
   * @param metrics metrics sink
   */
  public ResultDrain(Notifier notifier, String topic, OutstandingCount outstanding, MetricsPort metrics) {
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.topic = Strings.requireNonBlank("topic", topic);
    this.outstanding = Objects.requireNonNull(outstanding, "outstanding");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Drains every currently available result without waiting.
   *
   * @param dispatcher source of finished results
   * @return drained results, successful or not; empty when nothing finished since the last call
   */
  public List<WorkResult> drain(WorkDispatcher dispatcher) {
    List<WorkResult> results = dispatcher.drainCompleted();
    for (WorkResult result : results) {
      outstanding.decrement();
      if (!result.succeeded()) {
        metrics.increment("warper.items.failed");
        log.debug("No notification for {} ({})", result.item().sourceUri(), result.failure().orElseThrow());
        continue;
      }
      metrics.increment("warper.items.succeeded");
      Notification notification = Notification.forResult(topic, result);
      try {
        notifier.publish(notification);
        metrics.increment("warper.notify.published");
        log.info("Warped {} to {}", result.item().sourceUri(), result.output().orElseThrow().uri());
      } catch (RuntimeException ex) {
        metrics.increment("warper.notify.error");
        log.error("Failed to publish completion of {}", result.item().sourceUri(), ex);
      }
    }
    return results;
  }
}
