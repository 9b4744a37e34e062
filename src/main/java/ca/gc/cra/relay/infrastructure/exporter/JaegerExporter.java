package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.infrastructure.codec.ZipkinJsonEncoder;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sends trace batches to a Jaeger collector through its Zipkin-compatible intake at {@code /api/v2/spans}.
 *
 * @since 0.1.0
 */
public final class JaegerExporter implements SignalExporter {
  public static final String SPANS_PATH = "/api/v2/spans";

  private final String id;
  private final HttpTransport transport;
  private final ZipkinJsonEncoder encoder;

  /**
   * Creates an exporter.
   *
   * @param id exporter id
   * @param transport HTTP transport bound to the collector's base endpoint
   * @param encoder Zipkin encoder
   */
  public JaegerExporter(String id, HttpTransport transport, ZipkinJsonEncoder encoder) {
    this.id = Objects.requireNonNull(id, "id");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.of(SignalType.TRACES);
  }

  @Override
  public void start() throws IOException {
    transport.start();
  }

  @Override
  public void checkReachable() throws ExportException {
    transport.checkReachable();
  }

  @Override
  public void export(Batch batch) throws ExportException, InterruptedException {
    byte[] body = encoder.encode(batch.signalsAs(SpanSignal.class));
    transport.post(transport.resolve(SPANS_PATH), "application/json", Map.of(), body);
  }
}
