package ca.gc.cra.relay.application.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Summary of a pipeline drain.
 *
 * @param pipelineId drained pipeline
 * @param completedBatches in-flight batches that reached a terminal state within the timeout
 * @param abandonedBatches batches whose outstanding attempts were cancelled
 * @param timeout recorded timeout, present only when the drain exceeded its grace period
 * @since 0.1.0
 */
public record DrainReport(
    String pipelineId, int completedBatches, int abandonedBatches, Optional<DrainTimeoutException> timeout) {

  public DrainReport {
    Objects.requireNonNull(pipelineId, "pipelineId");
    Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Indicates whether every batch finished before the timeout.
   *
   * @return {@code true} if nothing was abandoned
   */
  public boolean clean() {
    return timeout.isEmpty();
  }
}
