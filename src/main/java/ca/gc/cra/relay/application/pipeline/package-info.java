/**
 * <strong>Purpose:</strong> Pipeline orchestration: batching, concurrent exporter fan-out, lifecycle and routing.
 * <p><strong>Pipeline role:</strong> Receiver threads call {@link ca.gc.cra.relay.application.pipeline.SignalRouter}
 * consumers, which feed {@link ca.gc.cra.relay.application.pipeline.PipelineCoordinator}s.
 * <p><strong>Concurrency:</strong> One lock per pipeline accumulator; delivery tasks run on the shared
 * {@code relay-export-} pool and time triggers on the {@code relay-batch-} scheduler.
 * <p><strong>Observability:</strong> Emits {@code pipeline.*} and {@code exporter.*} metrics and logs with
 * {@code pipeline}/{@code exporter} MDC keys.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.pipeline;
