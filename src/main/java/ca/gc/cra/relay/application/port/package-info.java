/**
 * <strong>Purpose:</strong> Ports connecting pipelines to receivers, processors, exporters, clocks and metrics.
 * <p><strong>Pipeline role:</strong> Receiver -> processors -> batching -> exporter fan-out.
 * <p><strong>Concurrency:</strong> Each port documents its own guarantees; exporters must tolerate concurrent calls.
 * <p><strong>Observability:</strong> {@link ca.gc.cra.relay.application.port.MetricsPort} defines the metric names.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.port;
