/**
 * Process execution adapters implementing {@link ca.gc.cra.warper.application.port.CommandRunner}.
 * <p><strong>Concurrency:</strong> Each invocation owns its child process and stderr collector thread.</p>
 * <p><strong>Security:</strong> Commands are started from argument vectors; no shell is involved.</p>
 */
package ca.gc.cra.warper.infrastructure.process;
