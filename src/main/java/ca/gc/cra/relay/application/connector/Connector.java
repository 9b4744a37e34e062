package ca.gc.cra.relay.application.connector;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.application.port.SignalConsumer;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.application.port.SignalReceiver;
import ca.gc.cra.relay.application.port.SignalRejectedException;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Joins two pipelines: an exporter in the pipelines listing it under {@code exporters} and a
 * receiver in the pipelines listing it under {@code receivers}.
 * <p><strong>Role:</strong> One instance per connector id, shared by every pipeline that names it.</p>
 * <p><strong>Thread-safety:</strong> Export tasks call {@link #export(Batch)} concurrently; the downstream consumer
 * is set once on {@link #start(SignalConsumer)}.</p>
 * <p>Closing the receiver side does not stop forwarding. Upstream pipelines drain before downstream ones, so their
 * final batches still reach a running pipeline; once downstream pipelines stop, forwarding fails terminally.</p>
 *
 * @since 0.1.0
 */
public abstract class Connector implements SignalExporter, SignalReceiver {
  private static final Logger log = LoggerFactory.getLogger(Connector.class);

  private final String id;
  private volatile SignalConsumer downstream;

  protected Connector(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  @Override
  public final String id() {
    return id;
  }

  /**
   * Returns the signal types the connector emits for a given input type.
   *
   * @param input type consumed on the exporter side
   * @return emitted type
   * @throws IllegalArgumentException if the input type is not supported
   */
  public abstract SignalType outputType(SignalType input);

  /**
   * Returns every type the connector may emit.
   *
   * @return output types
   */
  public abstract Set<SignalType> outputTypes();

  /**
   * Converts a batch into the signals forwarded downstream.
   *
   * @param batch exported batch
   * @return signals of {@link #outputType(SignalType)}; may be empty
   */
  protected abstract List<Signal> transform(Batch batch);

  @Override
  public final void start(SignalConsumer consumer) {
    downstream = Objects.requireNonNull(consumer, "consumer");
    log.info("Connector {} forwarding {} into downstream pipelines", id, outputTypes());
  }

  @Override
  public final void export(Batch batch) throws ExportException {
    SignalConsumer consumer = downstream;
    if (consumer == null) {
      throw new ExportTransientException("Connector " + id + " has no running downstream pipeline yet");
    }
    List<Signal> signals = transform(batch);
    if (signals.isEmpty()) {
      return;
    }
    try {
      consumer.accept(outputType(batch.type()), signals);
    } catch (SignalRejectedException ex) {
      throw new ExportTerminalException("Connector " + id + " could not forward: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    log.debug("Connector {} receiver side closed", id);
  }
}
