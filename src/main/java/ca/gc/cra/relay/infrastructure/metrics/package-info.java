/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.relay.application.port.MetricsPort} for the relay's
 * own counters and latency histograms.
 * <p><strong>Configuration:</strong> {@code otel.metrics.exporter} ({@code otlp|none}),
 * {@code otel.exporter.otlp.endpoint}, {@code otel.metric.export.interval} and {@code otel.resource.attributes},
 * or their {@code OTEL_*} environment equivalents.</p>
 */
package ca.gc.cra.relay.infrastructure.metrics;
