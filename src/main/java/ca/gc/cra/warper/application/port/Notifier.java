package ca.gc.cra.warper.application.port;

import ca.gc.cra.warper.domain.warp.Notification;

/**
 * <strong>What:</strong> Port publishing completion notifications to the bus.
 * <p><strong>Thread-safety:</strong> Called only from the control thread.</p>
 * <p><strong>Observability:</strong> Implementations should log send failures; callers absorb exceptions.</p>
 *
 * @since WARPER 0.1
 */
public interface Notifier extends AutoCloseable {
  /**
   * Publishes one notification.
   *
   * @param notification message to publish; must not be {@code null}
   */
  void publish(Notification notification);

  /** Flushes pending messages and releases the connection. */
  @Override
  void close();
}
