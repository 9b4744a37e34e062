package ca.gc.cra.relay.domain.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PipelineStateTest {
  @Test
  void lifecycleTransitions() {
    assertEquals(EnumSet.of(PipelineState.STARTING), allowedFrom(PipelineState.STOPPED));
    assertEquals(EnumSet.of(PipelineState.RUNNING, PipelineState.STOPPED), allowedFrom(PipelineState.STARTING));
    assertEquals(EnumSet.of(PipelineState.DRAINING), allowedFrom(PipelineState.RUNNING));
    assertEquals(EnumSet.of(PipelineState.STOPPED), allowedFrom(PipelineState.DRAINING));
  }

  @Test
  void onlyRunningAcceptsSignals() {
    for (PipelineState state : PipelineState.values()) {
      if (state == PipelineState.RUNNING) {
        assertTrue(state.acceptsSignals());
      } else {
        assertFalse(state.acceptsSignals(), state.name());
      }
    }
  }

  private static Set<PipelineState> allowedFrom(PipelineState from) {
    Set<PipelineState> allowed = EnumSet.noneOf(PipelineState.class);
    for (PipelineState next : PipelineState.values()) {
      if (from.canTransitionTo(next)) {
        allowed.add(next);
      }
    }
    return allowed;
  }
}
