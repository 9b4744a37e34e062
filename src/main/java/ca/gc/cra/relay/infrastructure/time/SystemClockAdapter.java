package ca.gc.cra.relay.infrastructure.time;

import ca.gc.cra.relay.application.port.ClockPort;
import java.time.Instant;

/**
 * {@link ClockPort} backed by the system clock, reporting nanoseconds at the precision {@link Instant#now()} offers.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long nowNanos() {
    Instant now = Instant.now();
    return now.getEpochSecond() * 1_000_000_000L + now.getNano();
  }
}
