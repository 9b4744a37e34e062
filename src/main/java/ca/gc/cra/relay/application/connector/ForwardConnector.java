package ca.gc.cra.relay.application.connector;

import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Passes batches unchanged into pipelines of the same signal type.
 */
public final class ForwardConnector extends Connector {
  public ForwardConnector(String id) {
    super(id);
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.allOf(SignalType.class);
  }

  @Override
  public SignalType outputType(SignalType input) {
    return input;
  }

  @Override
  public Set<SignalType> outputTypes() {
    return EnumSet.allOf(SignalType.class);
  }

  @Override
  protected List<Signal> transform(Batch batch) {
    return batch.signals();
  }
}
