package ca.gc.cra.warper.domain.warp;

/**
 * Terminal failure categories for a single work item. None of them is retried.
 *
 * @since WARPER 0.1
 */
public enum FailureKind {
  /** The external tool binary could not be located. */
  EXECUTABLE_NOT_FOUND,
  /** The external tool exited with a non-zero status. */
  EXTERNAL_TOOL_ERROR,
  /** Reprojection succeeded but overview generation failed; the reprojected file stays on disk. */
  OVERVIEW_GENERATION_ERROR,
  /** The external tool exceeded the configured command timeout and was destroyed. */
  TIMED_OUT,
  /** The worker threw unexpectedly while processing the item. */
  WORKER_CRASH
}
