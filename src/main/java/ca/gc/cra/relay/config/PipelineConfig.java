package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code service.pipelines} entry.
 *
 * @param id pipeline id such as {@code traces} or {@code metrics/internal}
 * @param signalType signal type derived from the id prefix
 * @param receivers receiver and connector ids feeding the pipeline
 * @param processors processor ids in execution order
 * @param exporters exporter and connector ids receiving every batch
 * @param deliveryPolicy per-pipeline override of the service delivery policy
 * @since 0.1.0
 */
public record PipelineConfig(
    String id,
    SignalType signalType,
    List<ComponentId> receivers,
    List<ComponentId> processors,
    List<ComponentId> exporters,
    Optional<DeliveryPolicy> deliveryPolicy) {

  public PipelineConfig {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(signalType, "signalType");
    receivers = List.copyOf(receivers);
    processors = List.copyOf(processors);
    exporters = List.copyOf(exporters);
    deliveryPolicy = Objects.requireNonNullElse(deliveryPolicy, Optional.empty());
  }
}
