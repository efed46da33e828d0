package ca.gc.cra.warper.application.warp;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cross-thread shutdown request flag.
 * <p>Set once by the termination handler and polled by the control thread. Never reset.</p>
 *
 * @since WARPER 0.1
 */
public final class ShutdownSignal {
  private final AtomicBoolean requested = new AtomicBoolean();

  /**
   * Requests shutdown; does not block.
   *
   * @return {@code true} for the first request, {@code false} if already requested
   */
  public boolean request() {
    return requested.compareAndSet(false, true);
  }

  /** @return whether shutdown has been requested */
  public boolean isRequested() {
    return requested.get();
  }
}
