package ca.gc.cra.relay.application.pipeline;

import java.time.Duration;

/**
 * Recorded when a pipeline could not bring every in-flight batch to a terminal state within the drain timeout.
 *
 * @since 0.1.0
 */
public class DrainTimeoutException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String pipelineId;
  private final int abandonedBatches;

  /**
   * Creates the exception.
   *
   * @param pipelineId pipeline that timed out
   * @param timeout configured drain timeout
   * @param abandonedBatches number of batches whose outstanding attempts were cancelled
   */
  public DrainTimeoutException(String pipelineId, Duration timeout, int abandonedBatches) {
    super("Pipeline " + pipelineId + " did not drain within " + timeout.toMillis() + "ms; "
        + abandonedBatches + " batch(es) abandoned");
    this.pipelineId = pipelineId;
    this.abandonedBatches = abandonedBatches;
  }

  public String pipelineId() {
    return pipelineId;
  }

  public int abandonedBatches() {
    return abandonedBatches;
  }
}
