package ca.gc.cra.relay.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff applied independently to each exporter.
 *
 * @param enabled whether transient failures are retried at all
 * @param initialInterval delay before the second attempt
 * @param maxInterval upper bound for any single delay
 * @param multiplier growth factor applied after each retry; at least {@code 1.0}
 * @param maxAttempts total attempts including the first; at least {@code 1}
 * @since 0.1.0
 */
public record RetryPolicy(
    boolean enabled, Duration initialInterval, Duration maxInterval, double multiplier, int maxAttempts) {

  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(30);
  public static final double DEFAULT_MULTIPLIER = 1.5d;
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  /**
   * Validates the policy.
   */
  public RetryPolicy {
    Objects.requireNonNull(initialInterval, "initialInterval");
    Objects.requireNonNull(maxInterval, "maxInterval");
    if (initialInterval.isNegative() || maxInterval.isNegative()) {
      throw new IllegalArgumentException("retry intervals must not be negative");
    }
    if (maxInterval.compareTo(initialInterval) < 0) {
      throw new IllegalArgumentException("max_interval must be >= initial_interval");
    }
    if (!(multiplier >= 1.0d) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be a finite value >= 1.0 (was " + multiplier + ")");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("max_attempts must be >= 1 (was " + maxAttempts + ")");
    }
  }

  /**
   * Returns the collector's default retry settings.
   *
   * @return enabled policy with 5s initial, 30s max, 1.5 multiplier and 5 attempts
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(true, DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL, DEFAULT_MULTIPLIER, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Returns a policy that never retries.
   *
   * @return single-attempt policy
   */
  public static RetryPolicy disabled() {
    return new RetryPolicy(false, Duration.ZERO, Duration.ZERO, 1.0d, 1);
  }

  /**
   * Returns the number of attempts this policy allows.
   *
   * @return {@code maxAttempts} when enabled, otherwise one
   */
  public int attemptBudget() {
    return enabled ? maxAttempts : 1;
  }

  /**
   * Computes the delay to wait after a failed attempt.
   *
   * @param failedAttempt one-based number of the attempt that just failed
   * @return delay before the next attempt, capped at {@link #maxInterval()}
   */
  public Duration backoff(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1");
    }
    double nanos = initialInterval.toNanos() * Math.pow(multiplier, failedAttempt - 1);
    long cap = maxInterval.toNanos();
    return nanos >= cap ? maxInterval : Duration.ofNanos((long) nanos);
  }
}
