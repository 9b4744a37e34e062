package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.config.EnvironmentSnapshot;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ValidateCliTest {
  private static final EnvironmentSnapshot ENV = EnvironmentSnapshot.of(Map.of("UPSTREAM_TOKEN", "s3cr3t-value"));

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ValidateCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void validConfigurationPrintsPlan() throws IOException {
    Path config = write("""
        receivers:
          otlp:
        exporters:
          otlp/upstream:
            endpoint: http://127.0.0.1:4318
            headers:
              authorization: Bearer ${UPSTREAM_TOKEN}
          logging:
        service:
          pipelines:
            traces:
              receivers: [otlp]
              exporters: [otlp/upstream, logging]
        """);

    ExitCode code = ValidateCli.run(new String[] {"config=" + config}, ENV);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("is valid"), out);
    assertTrue(out.contains("pipelines (drain order):"), out);
    assertTrue(out.contains("otlp/upstream (otlp/http http://127.0.0.1:4318"), out);
    assertFalse(out.contains("s3cr3t-value"), out);
  }

  @Test
  void undefinedExporterIsConfigError() throws IOException {
    Path config = write("""
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

    ExitCode code = ValidateCli.run(new String[] {"config=" + config}, ENV);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().contains("references undefined exporter jaeger"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid configuration")));
  }

  @Test
  void missingFileIsIoError() {
    ExitCode code = ValidateCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, ENV);
    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void missingConfigArgumentIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ValidateCli.run(new String[0], ENV));
    assertTrue(buffer.toString().contains("usage: relay validate"));
  }

  @Test
  void unknownArgumentIsInvalidArgs() {
    ExitCode code = ValidateCli.run(new String[] {"config=relay.yaml", "verbosity=high"}, ENV);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("unknown argument(s): verbosity")));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ValidateCli.run(new String[] {"--help"}, ENV));
    assertTrue(buffer.toString().contains("Relay configuration validation"));
  }

  private Path write(String yaml) throws IOException {
    Path file = tempDir.resolve("relay.yaml");
    Files.writeString(file, yaml);
    return file;
  }
}
