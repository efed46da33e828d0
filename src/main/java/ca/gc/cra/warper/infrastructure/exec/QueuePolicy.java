package ca.gc.cra.warper.infrastructure.exec;

import java.util.Locale;

/**
 * Behaviour of the worker pool when its hand-off queue is full.
 *
 * @since WARPER 0.1
 */
public enum QueuePolicy {
  /** The submitting thread waits until the queue has room. */
  BLOCK,
  /** The submission is refused immediately. */
  REJECT;

  /**
   * Parses a policy name, case-insensitively.
   *
   * @param raw configured value; {@code null} or blank yields {@link #BLOCK}
   * @return parsed policy
   * @throws IllegalArgumentException if the value is not a known policy
   */
  public static QueuePolicy fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return BLOCK;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "BLOCK" -> BLOCK;
      case "REJECT" -> REJECT;
      default -> throw new IllegalArgumentException("queue_policy must be BLOCK or REJECT (was '" + raw + "')");
    };
  }
}
