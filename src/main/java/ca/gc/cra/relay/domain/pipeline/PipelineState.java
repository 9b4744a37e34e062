package ca.gc.cra.relay.domain.pipeline;

/**
 * Lifecycle states of a pipeline.
 * <p>Legal transitions: {@code STOPPED -> STARTING -> RUNNING -> DRAINING -> STOPPED}, plus
 * {@code STARTING -> STOPPED} when startup fails.</p>
 *
 * @since 0.1.0
 */
public enum PipelineState {
  STOPPED,
  STARTING,
  RUNNING,
  DRAINING;

  /**
   * Indicates whether signals may be accepted in this state.
   *
   * @return {@code true} only for {@link #RUNNING}
   */
  public boolean acceptsSignals() {
    return this == RUNNING;
  }

  /**
   * Checks whether moving from this state to {@code next} is legal.
   *
   * @param next candidate target state
   * @return {@code true} if the transition is part of the lifecycle
   */
  public boolean canTransitionTo(PipelineState next) {
    return switch (this) {
      case STOPPED -> next == STARTING;
      case STARTING -> next == RUNNING || next == STOPPED;
      case RUNNING -> next == DRAINING;
      case DRAINING -> next == STOPPED;
    };
  }
}
