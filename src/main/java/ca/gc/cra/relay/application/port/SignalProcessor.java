package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.signal.Signal;
import java.util.List;

/**
 * Transformation applied to received signals before batching.
 * <p>Processors run in declaration order on the receiver thread; implementations must be thread-safe
 * and must preserve the relative order of the signals they keep.</p>
 *
 * @since 0.1.0
 */
public interface SignalProcessor {
  /**
   * Returns the configured processor identifier.
   *
   * @return processor id
   */
  String id();

  /**
   * Transforms a list of signals.
   *
   * @param signals input in receipt order
   * @return transformed signals; may be the same list when nothing changes
   */
  List<Signal> process(List<Signal> signals);
}
