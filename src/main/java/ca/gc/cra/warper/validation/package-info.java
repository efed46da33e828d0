/**
 * Input validation helpers used while loading configuration and CLI arguments.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.</p>
 * <p><strong>Observability:</strong> No logging; violations surface as {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.warper.validation;
