package ca.gc.cra.warper.application.port;

import ca.gc.cra.warper.domain.warp.InboundEvent;
import java.time.Duration;

/**
 * Open subscription yielding inbound events one at a time.
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe; used only by the control thread.</p>
 *
 * @since WARPER 0.1
 */
public interface EventSubscription extends AutoCloseable {
  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @param timeout maximum wait
   * @return next event, or {@link InboundEvent#heartbeat()} when nothing arrived in time
   */
  InboundEvent next(Duration timeout);

  /** Releases the subscription's connection. */
  @Override
  void close();
}
