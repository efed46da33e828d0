package ca.gc.cra.warper.application.port;

import ca.gc.cra.warper.domain.warp.CommandResult;
import java.util.List;

/**
 * <strong>What:</strong> Port that runs one external command and reports its outcome.
 * <p><strong>Role:</strong> Leaf collaborator of {@link ca.gc.cra.warper.application.warp.ReprojectionStep}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Start the process with the exact argument vector (no shell expansion) and wait for it.</li>
 *   <li>Translate a missing executable or non-zero exit into a failed {@link CommandResult}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from worker threads.</p>
 *
 * @implNote Implementations never throw for tool failures and never retry.
 * @since WARPER 0.1
 */
public interface CommandRunner {
  /**
   * Runs the command and blocks until it exits.
   *
   * @param argv program name followed by its arguments; must not be empty
   * @return success with an elapsed-time message, or failure with a category and diagnostic
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  CommandResult run(List<String> argv) throws InterruptedException;
}
