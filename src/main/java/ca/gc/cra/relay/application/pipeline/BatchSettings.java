package ca.gc.cra.relay.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Dual-trigger batching parameters.
 *
 * @param sendBatchSize signal count that triggers a flush; at least one
 * @param timeout maximum age of the oldest buffered signal before a flush; positive
 * @param sendBatchMaxSize hard upper bound per batch, or zero for unbounded
 * @since 0.1.0
 */
public record BatchSettings(int sendBatchSize, Duration timeout, int sendBatchMaxSize) {

  public static final int DEFAULT_SEND_BATCH_SIZE = 8192;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(200);

  public BatchSettings {
    Objects.requireNonNull(timeout, "timeout");
    if (sendBatchSize < 1) {
      throw new IllegalArgumentException("send_batch_size must be >= 1 (was " + sendBatchSize + ")");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("batch timeout must be positive");
    }
    if (sendBatchMaxSize < 0) {
      throw new IllegalArgumentException("send_batch_max_size must be >= 0");
    }
    if (sendBatchMaxSize > 0 && sendBatchMaxSize < sendBatchSize) {
      throw new IllegalArgumentException("send_batch_max_size must be >= send_batch_size");
    }
  }

  /**
   * Returns the batch processor defaults.
   *
   * @return 8192 signals or 200ms, unbounded max size
   */
  public static BatchSettings defaults() {
    return new BatchSettings(DEFAULT_SEND_BATCH_SIZE, DEFAULT_TIMEOUT, 0);
  }

  /**
   * Returns the largest batch the accumulator may emit.
   *
   * @return {@code sendBatchMaxSize}, or {@link Integer#MAX_VALUE} when unbounded
   */
  public int effectiveMaxSize() {
    return sendBatchMaxSize == 0 ? Integer.MAX_VALUE : sendBatchMaxSize;
  }
}
