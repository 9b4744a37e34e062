package ca.gc.cra.relay.domain.signal;

import java.util.Map;

/**
 * <strong>What:</strong> One immutable unit of observability data: a span, a metric point, or a log record.
 * <p><strong>Why:</strong> Gives receivers, processors and exporters a single representation to move through
 * a pipeline regardless of which wire format produced it.</p>
 * <p><strong>Role:</strong> Domain value object created at receipt and consumed once flushed into a {@link Batch}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records and safe to share.</p>
 *
 * @since 0.1.0
 */
public interface Signal {

  /**
   * Returns the family this signal belongs to.
   *
   * @return signal type
   */
  SignalType type();

  /**
   * Returns the signal timestamp. Spans report their start time.
   *
   * @return epoch nanoseconds
   */
  long timestampNanos();

  /**
   * Returns attributes describing the entity that produced the signal (e.g., {@code service.name}).
   *
   * @return immutable resource attributes
   */
  Map<String, Object> resource();

  /**
   * Returns attributes attached to this individual signal.
   *
   * @return immutable signal attributes
   */
  Map<String, Object> attributes();

  /**
   * Returns a copy of this signal carrying the supplied attributes.
   *
   * @param attributes replacement attributes
   * @return new signal instance; {@code this} is left untouched
   */
  Signal withAttributes(Map<String, Object> attributes);
}
