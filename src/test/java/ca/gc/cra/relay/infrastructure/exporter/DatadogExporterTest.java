package ca.gc.cra.relay.infrastructure.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.DatadogEncoder;
import ca.gc.cra.relay.testutil.StubHttpServer;
import ca.gc.cra.relay.testutil.TestSignals;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatadogExporterTest {

  @Test
  void routesEachSignalTypeToItsIntake() throws Exception {
    try (StubHttpServer api = new StubHttpServer();
        StubHttpServer logs = new StubHttpServer();
        StubHttpServer agent = new StubHttpServer()) {
      DatadogExporter exporter = new DatadogExporter("datadog", "dd-key",
          transport(api), transport(logs), transport(agent), new DatadogEncoder());
      exporter.start();

      exporter.export(TestSignals.batchOf(SignalType.METRICS, List.of(
          MetricSignal.histogram("latency", "ms", 2, 30, 1_700_000_000_000_000_000L,
              Map.of("service.name", "checkout"), Map.of()))));
      exporter.export(TestSignals.batchOf(SignalType.LOGS, List.of(TestSignals.log("ready"))));
      exporter.export(TestSignals.traceBatch(2));

      StubHttpServer.Request series = api.requests().get(0);
      assertEquals("/api/v2/series", series.path());
      assertEquals("dd-key", series.headers().getFirst("DD-API-KEY"));
      assertTrue(series.body().contains("\"metric\":\"latency.count\""), series.body());
      assertTrue(series.body().contains("\"metric\":\"latency.sum\""), series.body());
      assertTrue(series.body().contains("\"timestamp\":1700000000"), series.body());

      StubHttpServer.Request logRequest = logs.requests().get(0);
      assertEquals("/api/v2/logs", logRequest.path());
      assertTrue(logRequest.body().contains("\"message\":\"ready\""), logRequest.body());
      assertTrue(logRequest.body().contains("\"service\":\"checkout\""), logRequest.body());

      StubHttpServer.Request traces = agent.requests().get(0);
      assertEquals("/v0.3/traces", traces.path());
      assertNull(traces.headers().getFirst("DD-API-KEY"));
      assertTrue(traces.body().startsWith("[["), traces.body());
      assertTrue(traces.body().contains("\"resource\":\"GET /orders\""), traces.body());
    }
  }

  @Test
  void siteEndpoints() {
    assertEquals("https://api.datadoghq.eu", DatadogExporter.apiEndpoint("datadoghq.eu"));
    assertEquals("https://http-intake.logs.datadoghq.com", DatadogExporter.logsEndpoint("datadoghq.com"));
  }

  private static HttpTransport transport(StubHttpServer server) {
    return new HttpTransport("datadog", HttpTransport.Settings.of(URI.create(server.baseUrl())));
  }
}
