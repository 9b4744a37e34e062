package ca.gc.cra.relay.application.pipeline;

/**
 * Per-exporter limits on the shared export pool.
 *
 * @param consumers delivery attempts of one exporter allowed to run at the same time
 * @param queueSize attempts allowed to wait for a free consumer before new ones fail
 * @since 0.1.0
 */
public record SendingQueue(int consumers, int queueSize) {
  public static final int DEFAULT_CONSUMERS = 4;
  public static final int DEFAULT_QUEUE_SIZE = 1000;

  public SendingQueue {
    if (consumers < 1) {
      throw new IllegalArgumentException("num_consumers must be >= 1 (was " + consumers + ")");
    }
    if (queueSize < 0) {
      throw new IllegalArgumentException("queue_size must be >= 0 (was " + queueSize + ")");
    }
  }

  public static SendingQueue defaults() {
    return new SendingQueue(DEFAULT_CONSUMERS, DEFAULT_QUEUE_SIZE);
  }
}
