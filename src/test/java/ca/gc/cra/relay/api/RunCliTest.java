package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunCliTest {
  private static final String EXPORTER_PROPERTY = "otel.metrics.exporter";

  @TempDir Path tempDir;

  private String previousExporter;

  @BeforeEach
  void setUp() {
    previousExporter = System.getProperty(EXPORTER_PROPERTY);
    CliPrinter.setWriterForTesting(new PrintWriter(new StringWriter()));
  }

  @AfterEach
  void tearDown() {
    if (previousExporter == null) {
      System.clearProperty(EXPORTER_PROPERTY);
    } else {
      System.setProperty(EXPORTER_PROPERTY, previousExporter);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void undefinedExporterStopsBeforeStart() throws IOException {
    Path config = tempDir.resolve("relay.yaml");
    Files.writeString(config, """
        receivers:
          otlp:
            protocols:
              http:
                endpoint: 127.0.0.1:0
        exporters:
          otlp:
            endpoint: http://127.0.0.1:4318
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [otlp, jaeger]
        """);

    ExitCode code = RunCli.run(new String[] {"config=" + config, "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void malformedYamlIsConfigError() throws IOException {
    Path config = tempDir.resolve("relay.yaml");
    Files.writeString(config, "service: [unterminated");

    assertEquals(ExitCode.CONFIG_ERROR, RunCli.run(new String[] {"config=" + config, "metricsExporter=none"}));
  }

  @Test
  void invalidTelemetryArgumentsAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS,
        RunCli.run(new String[] {"config=relay.yaml", "metricsExporter=prometheus"}));
    assertEquals(ExitCode.INVALID_ARGS,
        RunCli.run(new String[] {"config=relay.yaml", "otelEndpoint=ftp://otel"}));
  }

  @Test
  void telemetryConfiguratorConsumesItsKeys() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "NONE", "config", "relay.yaml"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("none", System.getProperty(EXPORTER_PROPERTY));
    assertEquals(Map.of("config", "relay.yaml"), args);
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http://"))));
  }
}
