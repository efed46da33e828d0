/**
 * Metrics adapters implementing {@link ca.gc.cra.warper.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Bridges WARPER counters and histograms to OpenTelemetry; the OTLP exporter is
 * selected through {@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps and safe across worker threads.</p>
 */
package ca.gc.cra.warper.infrastructure.metrics;
