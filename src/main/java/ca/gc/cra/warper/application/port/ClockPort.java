package ca.gc.cra.warper.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the event loop.
 * <p><strong>Why:</strong> Lets idle-restart decisions run against a deterministic clock in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since WARPER 0.1
 * @see ca.gc.cra.warper.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();
}
