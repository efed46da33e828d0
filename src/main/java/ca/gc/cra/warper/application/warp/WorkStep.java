package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.domain.warp.WorkItem;
import ca.gc.cra.warper.domain.warp.WorkResult;

/**
 * Unit of work executed by a {@link WorkDispatcher} worker.
 *
 * @since WARPER 0.1
 */
@FunctionalInterface
public interface WorkStep {
  /**
   * Processes one item to completion.
   *
   * @param item item to process
   * @return outcome for the item; never {@code null}
   * @throws InterruptedException if the worker is interrupted while waiting on an external process
   */
  WorkResult execute(WorkItem item) throws InterruptedException;
}
