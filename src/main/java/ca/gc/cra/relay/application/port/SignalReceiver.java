package ca.gc.cra.relay.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port for inbound transports that decode signals and hand them to pipelines.
 * <p><strong>Why:</strong> Lets the collector start and stop HTTP, stream, Kafka and connector intakes uniformly.</p>
 * <p><strong>Role:</strong> Input port; adapters live in {@code infrastructure.receiver} and
 * {@code infrastructure.connector}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject malformed input per request or per line without tearing down the transport.</li>
 *   <li>Forward decoded signals to the supplied {@link SignalConsumer}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #start(SignalConsumer)} and {@link #close()} are invoked from the
 * collector thread; the consumer is called from the receiver's own workers.</p>
 *
 * @since 0.1.0
 */
public interface SignalReceiver extends AutoCloseable {
  /**
   * Returns the configured receiver identifier (e.g., {@code otlp} or {@code otlp/stream}).
   *
   * @return receiver id
   */
  String id();

  /**
   * Begins accepting input.
   *
   * @param consumer destination for decoded signals
   * @throws IOException if the transport cannot be bound or connected
   */
  void start(SignalConsumer consumer) throws IOException;

  /**
   * Stops accepting input and releases transport resources. Idempotent.
   */
  @Override
  void close();
}
