package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to batching and export flows.
 * <p><strong>Why:</strong> Batch creation instants and synthesized metric points need a time source that tests
 * can pin.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on receiver, batch
 * and export threads.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current epoch time in nanoseconds at millisecond precision.
   *
   * @return nanoseconds since 1970-01-01T00:00:00Z
   */
  default long nowNanos() {
    return nowMillis() * 1_000_000L;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
