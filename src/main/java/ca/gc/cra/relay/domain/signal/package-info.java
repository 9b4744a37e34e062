/**
 * <strong>Purpose:</strong> Immutable signal model (spans, metric points, log records) and batches.
 * <p><strong>Pipeline role:</strong> Produced by receivers, transformed by processors, grouped into
 * {@link ca.gc.cra.relay.domain.signal.Batch} instances and consumed by exporters.
 * <p><strong>Concurrency:</strong> All types are immutable and thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.signal;
