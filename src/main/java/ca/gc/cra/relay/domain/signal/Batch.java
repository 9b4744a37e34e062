package ca.gc.cra.relay.domain.signal;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered group of same-type signals flushed together by a pipeline.
 * <p><strong>Role:</strong> Unit of work handed from the batching stage to the exporter fan-out.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the signal list is copied on construction so the
 * producer keeps no reference after hand-off.</p>
 *
 * @param pipelineId owning pipeline identifier (e.g., {@code traces})
 * @param type signal type shared by every element
 * @param sequence per-pipeline sequence number, increasing in flush order
 * @param createdAt flush instant
 * @param signals signals in receipt order; never empty
 * @since 0.1.0
 */
public record Batch(String pipelineId, SignalType type, long sequence, Instant createdAt, List<Signal> signals) {

  /**
   * Validates batch invariants.
   *
   * @throws IllegalArgumentException if the batch is empty or mixes signal types
   */
  public Batch {
    Objects.requireNonNull(pipelineId, "pipelineId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(createdAt, "createdAt");
    signals = List.copyOf(Objects.requireNonNull(signals, "signals"));
    if (signals.isEmpty()) {
      throw new IllegalArgumentException("batch must contain at least one signal");
    }
    for (Signal signal : signals) {
      if (signal.type() != type) {
        throw new IllegalArgumentException(
            "batch of " + type + " cannot contain " + signal.type() + " signal");
      }
    }
  }

  /**
   * Returns the number of signals in the batch.
   *
   * @return signal count
   */
  public int size() {
    return signals.size();
  }

  /**
   * Returns the signals narrowed to a concrete type.
   *
   * @param kind concrete signal class
   * @param <T> concrete signal type
   * @return typed view of the signals
   * @throws ClassCastException if an element is not an instance of {@code kind}
   */
  public <T extends Signal> List<T> signalsAs(Class<T> kind) {
    return signals.stream().map(kind::cast).toList();
  }
}
