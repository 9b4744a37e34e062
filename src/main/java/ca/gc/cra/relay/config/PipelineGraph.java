package ca.gc.cra.relay.config;

import ca.gc.cra.relay.application.pipeline.BatchSettings;
import ca.gc.cra.relay.application.pipeline.ExporterBinding;
import ca.gc.cra.relay.application.pipeline.RetryPolicy;
import ca.gc.cra.relay.application.port.SignalProcessor;
import ca.gc.cra.relay.application.port.SignalReceiver;
import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable result of resolving a {@link CollectorConfig}: instantiated (unstarted)
 * receivers, processors and exporters wired into pipelines.
 * <p><strong>Why:</strong> Separates validation from startup so {@code relay validate} can print the plan without
 * binding a single socket.</p>
 * <p><strong>Role:</strong> Output of {@link CompositionRoot#resolve(CollectorConfig)} and input of
 * {@link CompositionRoot#build(PipelineGraph)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the component instances it holds are not started.</p>
 *
 * @since 0.1.0
 */
public final class PipelineGraph {
  private final List<PipelineNode> pipelines;
  private final List<ReceiverNode> receivers;
  private final Duration drainTimeout;
  private final int exportWorkers;

  PipelineGraph(List<PipelineNode> pipelines, List<ReceiverNode> receivers, Duration drainTimeout, int exportWorkers) {
    this.pipelines = List.copyOf(pipelines);
    this.receivers = List.copyOf(receivers);
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    this.exportWorkers = exportWorkers;
  }

  /**
   * Returns the pipelines in start and drain order: a pipeline exporting to a connector precedes every pipeline
   * receiving from it.
   *
   * @return ordered pipelines
   */
  public List<PipelineNode> pipelines() {
    return pipelines;
  }

  /**
   * Returns every intake, connectors included, with the pipelines each one feeds.
   *
   * @return receivers in declaration order
   */
  public List<ReceiverNode> receivers() {
    return receivers;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public int exportWorkers() {
    return exportWorkers;
  }

  /**
   * Looks up a pipeline by id.
   *
   * @param id pipeline id
   * @return pipeline node when defined
   */
  public Optional<PipelineNode> pipeline(String id) {
    return pipelines.stream().filter(p -> p.id().equals(id)).findFirst();
  }

  /**
   * Renders a human-readable plan. Header values that look like credentials are redacted.
   *
   * @return multi-line plan text
   */
  public String describe() {
    StringBuilder out = new StringBuilder();
    out.append("receivers:\n");
    for (ReceiverNode receiver : receivers) {
      out.append("  ").append(receiver.description())
          .append(" -> ").append(String.join(", ", receiver.pipelines())).append('\n');
    }
    out.append("pipelines (drain order):\n");
    for (PipelineNode pipeline : pipelines) {
      out.append("  ").append(pipeline.id())
          .append(" [").append(pipeline.signalType().path())
          .append(", ").append(pipeline.deliveryPolicy().name().toLowerCase(Locale.ROOT)).append("]\n");
      out.append("    receivers: ").append(String.join(", ", pipeline.receivers())).append('\n');
      out.append("    processors: ");
      if (pipeline.processors().isEmpty() && pipeline.batching().isEmpty()) {
        out.append("none");
      } else {
        StringBuilder chain = new StringBuilder();
        for (SignalProcessor processor : pipeline.processors()) {
          chain.append(chain.length() == 0 ? "" : ", ").append(processor.id());
        }
        pipeline.batching().ifPresent(b -> chain.append(chain.length() == 0 ? "" : ", ")
            .append("batch(size=").append(b.sendBatchSize())
            .append(", timeout=").append(Durations.format(b.timeout()))
            .append(", max=").append(b.sendBatchMaxSize()).append(')'));
        out.append(chain);
      }
      out.append('\n');
      out.append("    exporters:\n");
      for (ExporterNode exporter : pipeline.exporters()) {
        out.append("      ").append(exporter.description());
        RetryPolicy retry = exporter.binding().retry();
        out.append(retry.enabled()
            ? " retry(max_attempts=" + retry.maxAttempts() + ")"
            : " retry(off)");
        if (exporter.binding().required()) {
          out.append(" required");
        }
        out.append('\n');
      }
    }
    out.append("shutdown.drain_timeout: ").append(Durations.format(drainTimeout)).append('\n');
    out.append("export.workers: ").append(exportWorkers).append('\n');
    return out.toString();
  }

  @Override
  public String toString() {
    Map<String, SignalType> summary = new LinkedHashMap<>();
    pipelines.forEach(p -> summary.put(p.id(), p.signalType()));
    return "PipelineGraph" + summary;
  }

  /**
   * One resolved pipeline.
   *
   * @param id pipeline id
   * @param signalType signal type carried
   * @param receivers receiver and connector ids feeding the pipeline
   * @param processors non-batching processors in declaration order
   * @param batching batch settings when a {@code batch} processor is listed
   * @param exporters exporter bindings with their plan descriptions
   * @param deliveryPolicy effective delivery policy
   */
  public record PipelineNode(
      String id,
      SignalType signalType,
      List<String> receivers,
      List<SignalProcessor> processors,
      Optional<BatchSettings> batching,
      List<ExporterNode> exporters,
      DeliveryPolicy deliveryPolicy) {

    public PipelineNode {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(signalType, "signalType");
      receivers = List.copyOf(receivers);
      processors = List.copyOf(processors);
      batching = Objects.requireNonNullElse(batching, Optional.empty());
      exporters = List.copyOf(exporters);
      Objects.requireNonNull(deliveryPolicy, "deliveryPolicy");
    }
  }

  /**
   * An exporter bound into one pipeline.
   *
   * @param binding exporter with its retry policy and required flag
   * @param description redacted one-line summary for plans
   */
  public record ExporterNode(ExporterBinding binding, String description) {
    public ExporterNode {
      Objects.requireNonNull(binding, "binding");
      Objects.requireNonNull(description, "description");
    }
  }

  /**
   * An intake with the pipelines it feeds.
   *
   * @param receiver receiver instance; connectors appear here too
   * @param pipelines ids of the pipelines listing the receiver
   * @param description one-line summary for plans
   */
  public record ReceiverNode(SignalReceiver receiver, List<String> pipelines, String description) {
    public ReceiverNode {
      Objects.requireNonNull(receiver, "receiver");
      pipelines = List.copyOf(pipelines);
      Objects.requireNonNull(description, "description");
    }
  }
}
