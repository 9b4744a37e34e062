package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.pipeline.CollectorService;
import ca.gc.cra.relay.application.pipeline.DrainReport;
import ca.gc.cra.relay.application.pipeline.PipelineCoordinator;
import ca.gc.cra.relay.application.pipeline.SendingQueue;
import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.pipeline.PipelineState;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.receiver.OtlpHttpReceiver;
import ca.gc.cra.relay.testutil.OtlpPayloads;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final CompositionRoot root = new CompositionRoot(metrics);

  @Test
  void undefinedExporterFailsBeforeAnyPipelineRuns() {
    CollectorConfig config = parse("""
        receivers:
          otlp:
        exporters:
          otlp:
            endpoint: http://127.0.0.1:4318
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [otlp, jaeger]
        """);

    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(config));
    assertTrue(ex.getMessage().contains("references undefined exporter jaeger"), ex.getMessage());
  }

  @Test
  void resolvesFullGraph() {
    PipelineGraph graph = root.resolve(parse("""
        receivers:
          otlp:
            protocols:
              http:
                endpoint: 127.0.0.1:0
        processors:
          batch:
            send_batch_size: 100
            timeout: 1s
          attributes/env:
            actions:
              - key: env
                value: prod
                action: insert
        exporters:
          otlp/upstream:
            endpoint: http://127.0.0.1:4318
            headers:
              authorization: Bearer secret-token
            required: true
            retry_on_failure:
              max_attempts: 3
            sending_queue:
              num_consumers: 2
              queue_size: 50
          logging:
            retry_on_failure:
              enabled: false
        service:
          delivery_policy: all_required
          pipelines:
            traces:
              receivers: [otlp]
              processors: [attributes/env, batch]
              exporters: [otlp/upstream, logging]
            logs:
              receivers: [otlp]
              exporters: [logging]
              delivery_policy: at_least_one
        """));

    assertEquals(2, graph.pipelines().size());
    PipelineGraph.PipelineNode traces = graph.pipeline("traces").orElseThrow();
    assertEquals(SignalType.TRACES, traces.signalType());
    assertEquals(DeliveryPolicy.ALL_REQUIRED, traces.deliveryPolicy());
    assertEquals(1, traces.processors().size());
    assertEquals(100, traces.batching().orElseThrow().sendBatchSize());
    assertEquals(2, traces.exporters().size());
    assertTrue(traces.exporters().get(0).binding().required());
    assertEquals(3, traces.exporters().get(0).binding().retry().maxAttempts());
    assertEquals(new SendingQueue(2, 50), traces.exporters().get(0).binding().queue());
    assertFalse(traces.exporters().get(1).binding().retry().enabled());
    assertEquals(SendingQueue.defaults(), traces.exporters().get(1).binding().queue());
    assertEquals(DeliveryPolicy.AT_LEAST_ONE, graph.pipeline("logs").orElseThrow().deliveryPolicy());

    assertEquals(1, graph.receivers().size());
    assertEquals(List.of("traces", "logs"), graph.receivers().get(0).pipelines());

    String plan = graph.describe();
    assertTrue(plan.contains("otlp (otlp/http 127.0.0.1:0) -> traces, logs"), plan);
    assertTrue(plan.contains("traces [traces, all_required]"), plan);
    assertTrue(plan.contains("batch(size=100"), plan);
    assertTrue(plan.contains("required"), plan);
    assertFalse(plan.contains("secret-token"), plan);
  }

  @Test
  void connectorProducerPipelineIsOrderedFirst() {
    PipelineGraph graph = root.resolve(parse("""
        receivers:
          otlp:
        connectors:
          spanmetrics:
            dimensions: [http.method]
        exporters:
          logging:
        service:
          pipelines:
            metrics:
              receivers: [spanmetrics]
              exporters: [logging]
            traces:
              receivers: [otlp]
              exporters: [spanmetrics, logging]
        """));

    assertEquals(List.of("traces", "metrics"), graph.pipelines().stream().map(PipelineGraph.PipelineNode::id).toList());
    PipelineGraph.ReceiverNode connector = graph.receivers().stream()
        .filter(node -> node.receiver().id().equals("spanmetrics"))
        .findFirst()
        .orElseThrow();
    assertEquals(List.of("metrics"), connector.pipelines());
    assertFalse(graph.pipeline("traces").orElseThrow().exporters().get(0).binding().retry().enabled());
  }

  @Test
  void connectorOutputMustMatchConsumingPipeline() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        connectors:
          spanmetrics:
        exporters:
          logging:
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [spanmetrics]
            logs:
              receivers: [spanmetrics]
              exporters: [logging]
        """)));
    assertTrue(ex.getMessage().contains("emits [metrics] but pipeline logs carries logs"), ex.getMessage());
  }

  @Test
  void connectorMustHaveBothSides() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        connectors:
          forward:
        exporters:
          logging:
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [forward, logging]
        """)));
    assertTrue(ex.getMessage().contains("must be used as an exporter in one pipeline and as a receiver"));
  }

  @Test
  void connectorCycleIsRejected() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        connectors:
          forward/a:
          forward/b:
        exporters:
          logging:
        service:
          pipelines:
            traces/one:
              receivers: [forward/b]
              exporters: [forward/a, logging]
            traces/two:
              receivers: [forward/a]
              exporters: [forward/b]
        """)));
    assertTrue(ex.getMessage().contains("cycle"), ex.getMessage());
  }

  @Test
  void prometheusExporterCannotBeSharedBetweenPipelines() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        exporters:
          prometheus:
            endpoint: 127.0.0.1:0
        service:
          pipelines:
            metrics:
              receivers: [otlp]
              exporters: [prometheus]
            metrics/second:
              receivers: [otlp]
              exporters: [prometheus]
        """)));
    assertTrue(ex.getMessage().contains("binds a listening port"), ex.getMessage());
  }

  @Test
  void exporterMustSupportPipelineType() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        exporters:
          jaeger:
            endpoint: http://127.0.0.1:9411
        service:
          pipelines:
            logs:
              receivers: [otlp]
              exporters: [jaeger]
        """)));
    assertEquals("exporter jaeger does not support logs (pipeline logs)", ex.getMessage());
  }

  @Test
  void unknownComponentTypesAreRejected() {
    ConfigException receiver = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          zipkin:
        exporters:
          logging:
        service:
          pipelines:
            traces:
              receivers: [zipkin]
              exporters: [logging]
        """)));
    assertTrue(receiver.getMessage().contains("receiver zipkin has unknown type 'zipkin'"));

    ConfigException exporter = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        exporters:
          splunk_hec:
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [splunk_hec]
        """)));
    assertTrue(exporter.getMessage().contains("has unknown type 'splunk_hec'"));
  }

  @Test
  void invalidComponentSettingsNameTheirLocation() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        exporters:
          otlp:
            endpoint: http://127.0.0.1:4318
            compression: zstd
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [otlp]
        """)));
    assertTrue(ex.getMessage().contains("must be gzip or none"), ex.getMessage());
  }

  @Test
  void sendingQueueNeedsAConsumer() {
    ConfigException ex = assertThrows(ConfigException.class, () -> root.resolve(parse("""
        receivers:
          otlp:
        exporters:
          otlp:
            endpoint: http://127.0.0.1:4318
            sending_queue:
              num_consumers: 0
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [otlp]
        """)));
    assertTrue(ex.getMessage().contains("num_consumers must be >= 1"), ex.getMessage());
  }

  @Test
  void buildsStartsAndDrainsCollector() throws Exception {
    PipelineGraph graph = root.resolve(parse("""
        receivers:
          otlp:
            protocols:
              http:
                endpoint: 127.0.0.1:0
                workers: 2
        processors:
          batch:
            send_batch_size: 1000
            timeout: 10s
        exporters:
          logging:
        service:
          shutdown:
            drain_timeout: 5s
          export:
            workers: 2
          pipelines:
            traces:
              receivers: [otlp]
              processors: [batch]
              exporters: [logging]
        """));
    CollectorService service = root.build(graph, List.of());
    service.start();
    PipelineCoordinator pipeline = service.pipelines().get(0);
    List<DrainReport> reports;
    try {
      assertEquals(PipelineState.RUNNING, pipeline.state());
      OtlpHttpReceiver receiver = assertInstanceOf(OtlpHttpReceiver.class, service.receivers().get(0));
      HttpResponse<String> response = HttpClient.newHttpClient().send(
          HttpRequest.newBuilder(URI.create(
                  "http://127.0.0.1:" + receiver.boundAddress().getPort() + "/v1/traces"))
              .timeout(Duration.ofSeconds(5))
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(OtlpPayloads.traces(4)))
              .build(),
          HttpResponse.BodyHandlers.ofString());
      assertEquals(200, response.statusCode());
      assertEquals("{\"accepted\":4}", response.body());
    } finally {
      reports = service.shutdown();
    }

    assertEquals(PipelineState.STOPPED, pipeline.state());
    assertEquals(1, reports.size());
    assertTrue(reports.get(0).clean());
    assertEquals(1, metrics.count("pipeline.traces.batch.delivered"));
    assertEquals(reports, service.shutdown());
  }

  @Test
  void sampleConfigurationResolves() throws Exception {
    CollectorConfig config = CollectorConfigLoader.load(
        Path.of("config", "relay.yaml"), EnvironmentSnapshot.of(Map.of("HONEYCOMB_API_KEY", "hc-key")));

    PipelineGraph graph = root.resolve(config);

    assertEquals(List.of("traces", "logs", "metrics"),
        graph.pipelines().stream().map(PipelineGraph.PipelineNode::id).toList());
    String plan = graph.describe();
    assertTrue(plan.contains("jaeger (zipkin json http://jaeger:9411/api/v2/spans)"), plan);
    assertTrue(plan.contains("prometheus (prometheus http://0.0.0.0:8889/metrics)"), plan);
    assertFalse(plan.contains("hc-key"), plan);
  }

  private static CollectorConfig parse(String yaml) {
    return CollectorConfigLoader.parse(yaml, EnvironmentSnapshot.of(Map.of()));
  }
}
