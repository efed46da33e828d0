/**
 * Command-line entry point for the warper service.
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.api;
