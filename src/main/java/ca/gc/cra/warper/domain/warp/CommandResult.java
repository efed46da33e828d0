package ca.gc.cra.warper.domain.warp;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one external command invocation.
 *
 * @param ok {@code true} when the command ran and exited with status zero
 * @param message elapsed-time report on success; captured stderr or a diagnostic on failure
 * @param failure failure category; present iff {@code ok} is {@code false}
 * @param elapsed wall-clock time spent waiting for the command
 * @since WARPER 0.1
 */
public record CommandResult(boolean ok, String message, Optional<FailureKind> failure, Duration elapsed) {
  public CommandResult {
    message = Objects.requireNonNullElse(message, "");
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    if (ok == failure.isPresent()) {
      throw new IllegalArgumentException("failure kind must be present iff the command failed");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param message success report
   * @param elapsed time spent
   * @return successful result
   */
  public static CommandResult success(String message, Duration elapsed) {
    return new CommandResult(true, message, Optional.empty(), elapsed);
  }

  /**
   * Creates a failed result.
   *
   * @param kind failure category
   * @param message diagnostic text
   * @param elapsed time spent
   * @return failed result
   */
  public static CommandResult failure(FailureKind kind, String message, Duration elapsed) {
    return new CommandResult(false, message, Optional.of(Objects.requireNonNull(kind, "kind")), elapsed);
  }
}
