package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.SignalConsumer;
import ca.gc.cra.relay.application.port.SignalRejectedException;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes signals decoded by a receiver to every pipeline that lists the receiver for the matching signal type.
 * <p>Immutable after construction; safe for concurrent use by all receiver threads.</p>
 *
 * @since 0.1.0
 */
public final class SignalRouter {
  private final Map<String, Map<SignalType, List<PipelineCoordinator>>> routes;

  private SignalRouter(Map<String, Map<SignalType, List<PipelineCoordinator>>> routes) {
    this.routes = routes;
  }

  /**
   * Creates a builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the consumer a receiver should feed.
   *
   * @param receiverId receiver identifier
   * @return consumer dispatching to the receiver's pipelines
   */
  public SignalConsumer consumerFor(String receiverId) {
    Map<SignalType, List<PipelineCoordinator>> byType =
        routes.getOrDefault(Objects.requireNonNull(receiverId, "receiverId"), Map.of());
    return (type, signals) -> route(receiverId, byType, type, signals);
  }

  /**
   * Returns the signal types a receiver is bound to.
   *
   * @param receiverId receiver identifier
   * @return bound types, possibly empty
   */
  public Set<SignalType> boundTypes(String receiverId) {
    return routes.getOrDefault(receiverId, Map.of()).keySet();
  }

  /**
   * Returns the pipelines bound to a receiver for one signal type.
   *
   * @param receiverId receiver identifier
   * @param type signal type
   * @return bound pipelines, possibly empty
   */
  public List<PipelineCoordinator> pipelinesFor(String receiverId, SignalType type) {
    return routes.getOrDefault(receiverId, Map.of()).getOrDefault(type, List.of());
  }

  private static int route(
      String receiverId,
      Map<SignalType, List<PipelineCoordinator>> byType,
      SignalType type,
      List<Signal> signals) throws SignalRejectedException {
    List<PipelineCoordinator> targets = byType.getOrDefault(type, List.of());
    if (targets.isEmpty()) {
      throw new SignalRejectedException(
          "Receiver " + receiverId + " is not bound to any " + type.path() + " pipeline");
    }
    if (signals.isEmpty()) {
      return 0;
    }
    int accepted = -1;
    SignalRejectedException rejection = null;
    for (PipelineCoordinator pipeline : targets) {
      try {
        accepted = Math.max(accepted, pipeline.accept(signals));
      } catch (SignalRejectedException ex) {
        rejection = ex;
      }
    }
    if (accepted < 0) {
      throw rejection;
    }
    return accepted;
  }

  /**
   * Builder for {@link SignalRouter}.
   */
  public static final class Builder {
    private final Map<String, Map<SignalType, List<PipelineCoordinator>>> routes = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Binds a receiver to a pipeline for the pipeline's signal type.
     *
     * @param receiverId receiver identifier
     * @param pipeline destination pipeline
     * @return this builder
     */
    public Builder bind(String receiverId, PipelineCoordinator pipeline) {
      routes.computeIfAbsent(receiverId, k -> new EnumMap<>(SignalType.class))
          .computeIfAbsent(pipeline.signalType(), k -> new ArrayList<>())
          .add(pipeline);
      return this;
    }

    public SignalRouter build() {
      Map<String, Map<SignalType, List<PipelineCoordinator>>> copy = new LinkedHashMap<>();
      routes.forEach((receiver, byType) -> {
        Map<SignalType, List<PipelineCoordinator>> types = new EnumMap<>(SignalType.class);
        byType.forEach((type, pipelines) -> types.put(type, List.copyOf(pipelines)));
        copy.put(receiver, Collections.unmodifiableMap(types));
      });
      return new SignalRouter(Collections.unmodifiableMap(copy));
    }
  }
}
