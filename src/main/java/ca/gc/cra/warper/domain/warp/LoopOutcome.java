package ca.gc.cra.warper.domain.warp;

/**
 * Explicit result of one event-loop run.
 *
 * @since WARPER 0.1
 */
public enum LoopOutcome {
  /** The loop went idle past the restart timeout; resubscribe within the same process. */
  CONTINUE_SUBSCRIPTION,
  /** Termination was requested and all outstanding work drained; the process should exit. */
  TERMINATE
}
