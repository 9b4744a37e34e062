package ca.gc.cra.relay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("relay.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("exporter.otlp/a.sent");
    adapter.increment("exporter.otlp/a.sent");
    adapter.forceFlush();

    MetricData counter = metric("exporter.otlp_a.sent");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("exporter.otlp/a.sent", point.getAttributes().get(KEY));
    assertEquals("relay", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("pipeline.traces.batch.size", 10);
    adapter.observe("pipeline.traces.batch.size", 30);
    adapter.forceFlush();

    MetricData histogram = metric("pipeline.traces.batch.size");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(40d, point.getSum());
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("receiver.otlp_stream.signals", OpenTelemetryMetricsAdapter.sanitizeName("receiver.otlp/stream.signals"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("relay.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void parsesResourceAttributeList() {
    assertEquals("prod", OpenTelemetryBootstrap.parseResourceAttributes("env=prod, bad, =x")
        .get(AttributeKey.stringKey("env")));
    assertEquals(1, OpenTelemetryBootstrap.parseResourceAttributes("env=prod, bad, =x").size());
  }

  @Test
  void settingsPreferPropertiesOverEnvironment() {
    Properties props = new Properties();
    props.setProperty("otel.metrics.exporter", "NONE");
    Map<String, String> env = Map.of(
        "OTEL_METRICS_EXPORTER", "otlp",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://otel-collector:4317",
        "OTEL_METRIC_EXPORT_INTERVAL", "1500",
        "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=staging",
        "OTEL_RESOURCE_SERVICE_INSTANCE", "relay-7");

    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(props, env);

    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, settings.exporter());
    assertEquals("http://otel-collector:4317", settings.endpoint());
    assertEquals(Duration.ofMillis(1500), settings.interval());
    assertEquals("relay-7", settings.resource().getAttribute(AttributeKey.stringKey("service.instance.id")));
    assertEquals("staging", settings.resource().getAttribute(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void settingsFallBackToDefaults() {
    OpenTelemetryBootstrap.Settings settings =
        OpenTelemetryBootstrap.Settings.resolve(new Properties(), Map.of("OTEL_METRIC_EXPORT_INTERVAL", "-5"));

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertEquals(Duration.ofSeconds(30), settings.interval());
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
