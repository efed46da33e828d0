/**
 * Configuration loading and wiring for the warper service.
 * <p>{@link ca.gc.cra.warper.config.WarperConfigLoader} reads the YAML document with SnakeYAML,
 * {@link ca.gc.cra.warper.config.WarperConfig} validates and normalizes it, and
 * {@link ca.gc.cra.warper.config.CompositionRoot} turns it into a runnable service.</p>
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.config;
