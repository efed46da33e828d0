package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tunables for one {@link EventLoop} run.
 *
 * @param notificationTopic topic receiving completion notifications
 * @param restartTimeout idle period after which the subscription is recycled; empty disables idle restarts
 * @param pollTimeout maximum wait for one inbound event before a poll tick is produced
 * @since WARPER 0.1
 */
public record LoopSettings(String notificationTopic, Optional<Duration> restartTimeout, Duration pollTimeout) {
  /** Poll interval used when none is given. */
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

  public LoopSettings {
    Strings.requireNonBlank("notificationTopic", notificationTopic);
    restartTimeout = Objects.requireNonNullElse(restartTimeout, Optional.empty());
    pollTimeout = Objects.requireNonNullElse(pollTimeout, DEFAULT_POLL_TIMEOUT);
    if (pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be positive");
    }
  }

  /**
   * @param notificationTopic topic receiving completion notifications
   * @param restartTimeout idle restart period, when configured
   * @return settings using {@link #DEFAULT_POLL_TIMEOUT}
   */
  public static LoopSettings of(String notificationTopic, Optional<Duration> restartTimeout) {
    return new LoopSettings(notificationTopic, restartTimeout, DEFAULT_POLL_TIMEOUT);
  }
}
