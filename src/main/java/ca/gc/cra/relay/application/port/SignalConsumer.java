package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.util.List;

/**
 * Ingestion entry point handed to a {@link SignalReceiver} when it starts.
 * <p>Implementations route decoded signals to every pipeline bound to the receiver. Calls arrive
 * concurrently from receiver worker threads.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SignalConsumer {
  /**
   * Accepts decoded signals of one type.
   *
   * @param type type shared by every signal in the list
   * @param signals decoded signals in receipt order
   * @return number of signals accepted
   * @throws SignalRejectedException if no bound pipeline is accepting signals (e.g., while draining)
   */
  int accept(SignalType type, List<Signal> signals) throws SignalRejectedException;
}
