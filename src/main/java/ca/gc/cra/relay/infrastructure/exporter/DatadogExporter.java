package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.LogSignal;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.infrastructure.codec.DatadogEncoder;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Datadog exporter: metrics to {@code /api/v2/series}, logs to {@code /api/v2/logs} on the
 * log intake host and traces to an agent's {@code /v0.3/traces}.
 * <p><strong>Why:</strong> Lets one pipeline ship to Datadog without a local agent for metrics and logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared transports.</p>
 *
 * @since 0.1.0
 */
public final class DatadogExporter implements SignalExporter {
  static final String API_KEY_HEADER = "DD-API-KEY";

  private final String id;
  private final String apiKey;
  private final HttpTransport api;
  private final HttpTransport logs;
  private final HttpTransport agent;
  private final DatadogEncoder encoder;

  /**
   * Creates an exporter.
   *
   * @param id exporter id
   * @param apiKey Datadog API key
   * @param api transport for {@code https://api.<site>}
   * @param logs transport for {@code https://http-intake.logs.<site>}
   * @param agent transport for the trace agent
   * @param encoder payload encoder
   */
  public DatadogExporter(
      String id, String apiKey, HttpTransport api, HttpTransport logs, HttpTransport agent, DatadogEncoder encoder) {
    this.id = Objects.requireNonNull(id, "id");
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.api = Objects.requireNonNull(api, "api");
    this.logs = Objects.requireNonNull(logs, "logs");
    this.agent = Objects.requireNonNull(agent, "agent");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
  }

  /**
   * Builds the API base URI for a Datadog site.
   *
   * @param site site such as {@code datadoghq.com} or {@code datadoghq.eu}
   * @return metrics API base
   */
  public static String apiEndpoint(String site) {
    return "https://api." + site;
  }

  /**
   * Builds the log intake base URI for a Datadog site.
   *
   * @param site Datadog site
   * @return log intake base
   */
  public static String logsEndpoint(String site) {
    return "https://http-intake.logs." + site;
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
    api.start();
    logs.start();
    agent.start();
  }

  @Override
  public void checkReachable() throws ExportException {
    api.checkReachable();
  }

  @Override
  public void export(Batch batch) throws ExportException, InterruptedException {
    switch (batch.type()) {
      case METRICS -> api.post(api.resolve("/api/v2/series"), "application/json",
          Map.of(API_KEY_HEADER, apiKey), encoder.encodeSeries(batch.signalsAs(MetricSignal.class)));
      case LOGS -> logs.post(logs.resolve("/api/v2/logs"), "application/json",
          Map.of(API_KEY_HEADER, apiKey), encoder.encodeLogs(batch.signalsAs(LogSignal.class)));
      case TRACES -> agent.post(agent.resolve("/v0.3/traces"), "application/json",
          Map.of(), encoder.encodeTraces(batch.signalsAs(SpanSignal.class)));
    }
  }
}
