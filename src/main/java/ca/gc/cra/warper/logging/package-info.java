/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep tool diagnostics readable.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from worker threads.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.logging;
