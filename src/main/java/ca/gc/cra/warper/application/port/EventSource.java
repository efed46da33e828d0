package ca.gc.cra.warper.application.port;

/**
 * Opens subscriptions to the inbound notification stream.
 *
 * <p>Each event-loop run opens a fresh subscription so that idle restarts recycle the underlying
 * connection.</p>
 *
 * @since WARPER 0.1
 */
public interface EventSource {
  /**
   * Opens a new subscription.
   *
   * @return subscription owned by the caller; close it when the loop run ends
   */
  EventSubscription subscribe();
}
