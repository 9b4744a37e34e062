package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pushes batches as OTLP/JSON to {@code <endpoint>/v1/<signal>}.
 * <p>Serves Honeycomb, Elastic APM, OpenObserve and any other OTLP/HTTP intake; vendor specifics travel in the
 * configured headers.</p>
 *
 * @since 0.1.0
 */
public final class OtlpHttpExporter implements SignalExporter {
  private final String id;
  private final HttpTransport transport;
  private final OtlpJsonCodec codec;

  /**
   * Creates an exporter.
   *
   * @param id exporter id, e.g. {@code otlp/honeycomb}
   * @param transport HTTP transport bound to the base endpoint
   * @param codec OTLP/JSON codec
   */
  public OtlpHttpExporter(String id, HttpTransport transport, OtlpJsonCodec codec) {
    this.id = Objects.requireNonNull(id, "id");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.allOf(SignalType.class);
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
    byte[] body = codec.encode(batch.type(), batch.signals());
    transport.post(transport.resolve("/v1/" + batch.type().path()), "application/json", Map.of(), body);
  }
}
