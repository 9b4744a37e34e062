package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.io.IOException;
import java.util.Set;

/**
 * <strong>What:</strong> Output port delivering a batch of signals to one downstream sink.
 * <p><strong>Why:</strong> Isolates the fan-out from transport details so every sink fails, retries and
 * reports independently.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters in {@code infrastructure.exporter} and by
 * connectors.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize a batch into the sink's format and transmit it once per {@link #export(Batch)} call.</li>
 *   <li>Classify failures as {@link ExportTransientException} or {@link ExportTerminalException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #export(Batch)} may be called concurrently for different batches of the
 * same pipeline; implementations must be thread-safe. Retries are driven by the caller.</p>
 *
 * @since 0.1.0
 */
public interface SignalExporter extends AutoCloseable {
  /**
   * Returns the configured exporter identifier (e.g., {@code otlp/honeycomb}).
   *
   * @return exporter id
   */
  String id();

  /**
   * Returns the signal types this exporter can deliver.
   *
   * @return supported types
   */
  Set<SignalType> supportedTypes();

  /**
   * Allocates transport resources. Idempotent.
   *
   * @throws IOException if a local resource (listening socket, client) cannot be created
   */
  default void start() throws IOException {}

  /**
   * Verifies that the downstream endpoint is reachable. Invoked at startup only for exporters marked required.
   *
   * @throws ExportException if the endpoint cannot be reached
   */
  default void checkReachable() throws ExportException {}

  /**
   * Delivers one batch with a single transmission attempt.
   *
   * @param batch batch to deliver
   * @throws ExportTransientException if the attempt failed but may succeed when retried
   * @throws ExportTerminalException if the sink rejected the batch permanently
   * @throws InterruptedException if the calling thread was interrupted while transmitting
   */
  void export(Batch batch) throws ExportException, InterruptedException;

  /**
   * Releases transport resources. Idempotent.
   */
  @Override
  default void close() {}
}
