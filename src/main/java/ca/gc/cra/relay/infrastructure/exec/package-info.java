/**
 * Executor factories for export, receiver and batch-timer threads.
 * <p><strong>Concurrency:</strong> Threads are named per role ({@code relay-export-}, {@code relay-receiver-},
 * {@code relay-batch-}) and non-daemon so shutdown completes deliberately.</p>
 */
package ca.gc.cra.relay.infrastructure.exec;
