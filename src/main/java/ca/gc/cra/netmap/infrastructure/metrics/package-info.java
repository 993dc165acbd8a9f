/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.netmap.application.port.MetricsPort} adapters.
 * <p><strong>Observability:</strong> The OpenTelemetry adapter exports over OTLP; the no-op adapter is used
 * when no exporter is configured.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netmap.infrastructure.metrics;
