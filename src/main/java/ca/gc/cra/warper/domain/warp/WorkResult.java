package ca.gc.cra.warper.domain.warp;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of processing one {@link WorkItem}.
 * <p><strong>Role:</strong> Produced by a worker, handed to the control thread through the completion channel,
 * then published (success) or dropped after logging (failure).</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param item the processed work item, including its payload copy
 * @param output output descriptor; present iff reprojection and overview generation both succeeded
 * @param failure failure category; present iff {@code output} is absent
 * @since WARPER 0.1
 */
public record WorkResult(WorkItem item, Optional<OutputDescriptor> output, Optional<FailureKind> failure) {
  public WorkResult {
    Objects.requireNonNull(item, "item");
    output = Objects.requireNonNullElse(output, Optional.empty());
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    if (output.isPresent() == failure.isPresent()) {
      throw new IllegalArgumentException("exactly one of output or failure must be present");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param item processed item
   * @param output produced output
   * @return successful result
   */
  public static WorkResult succeeded(WorkItem item, OutputDescriptor output) {
    return new WorkResult(item, Optional.of(Objects.requireNonNull(output, "output")), Optional.empty());
  }

  /**
   * Creates a failed result carrying no output descriptor.
   *
   * @param item processed item
   * @param kind failure category
   * @return failed result
   */
  public static WorkResult failed(WorkItem item, FailureKind kind) {
    return new WorkResult(item, Optional.empty(), Optional.of(Objects.requireNonNull(kind, "kind")));
  }

  /**
   * Indicates whether the result should be announced downstream.
   *
   * @return {@code true} when an output descriptor is present
   */
  public boolean succeeded() {
    return output.isPresent();
  }
}
