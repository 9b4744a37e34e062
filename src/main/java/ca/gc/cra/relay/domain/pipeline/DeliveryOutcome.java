package ca.gc.cra.relay.domain.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated result of delivering one batch to every exporter of a pipeline.
 *
 * @param pipelineId owning pipeline
 * @param sequence batch sequence number
 * @param signalCount number of signals in the batch
 * @param results per-exporter results in exporter declaration order
 * @param delivered overall verdict according to the pipeline's {@link DeliveryPolicy}
 * @since 0.1.0
 */
public record DeliveryOutcome(
    String pipelineId, long sequence, int signalCount, List<ExportResult> results, boolean delivered) {

  public DeliveryOutcome {
    Objects.requireNonNull(pipelineId, "pipelineId");
    results = List.copyOf(Objects.requireNonNull(results, "results"));
  }

  /**
   * Builds an outcome by applying a policy to the results.
   *
   * @param pipelineId owning pipeline
   * @param sequence batch sequence number
   * @param signalCount signals in the batch
   * @param results per-exporter results
   * @param policy delivery policy
   * @return aggregated outcome
   */
  public static DeliveryOutcome of(
      String pipelineId, long sequence, int signalCount, List<ExportResult> results, DeliveryPolicy policy) {
    return new DeliveryOutcome(pipelineId, sequence, signalCount, results, policy.isDelivered(results));
  }

  /**
   * Looks up the result for one exporter.
   *
   * @param exporterId exporter identifier
   * @return result if the exporter took part in the delivery
   */
  public Optional<ExportResult> resultFor(String exporterId) {
    return results.stream().filter(r -> r.exporterId().equals(exporterId)).findFirst();
  }

  /**
   * Counts results with the given status.
   *
   * @param status status to count
   * @return number of matching results
   */
  public long count(ExportResult.Status status) {
    return results.stream().filter(r -> r.status() == status).count();
  }
}
