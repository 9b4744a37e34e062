package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.SignalExporter;
import java.util.Objects;

/**
 * Exporter attached to a pipeline together with its delivery settings.
 *
 * @param exporter exporter instance owned by the pipeline
 * @param retry retry policy for transient failures
 * @param required whether the endpoint must be reachable for the pipeline to start
 * @param queue concurrency and backlog limits for this exporter's delivery attempts
 * @since 0.1.0
 */
public record ExporterBinding(SignalExporter exporter, RetryPolicy retry, boolean required, SendingQueue queue) {

  public ExporterBinding {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(retry, "retry");
    Objects.requireNonNull(queue, "queue");
  }

  /**
   * Binds an exporter with the default sending queue.
   *
   * @param exporter exporter instance owned by the pipeline
   * @param retry retry policy for transient failures
   * @param required whether the endpoint must be reachable for the pipeline to start
   */
  public ExporterBinding(SignalExporter exporter, RetryPolicy retry, boolean required) {
    this(exporter, retry, required, SendingQueue.defaults());
  }

  /**
   * Returns the exporter identifier.
   *
   * @return exporter id
   */
  public String id() {
    return exporter.id();
  }
}
