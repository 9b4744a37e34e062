package ca.gc.cra.relay.api;

import ca.gc.cra.relay.application.pipeline.CollectorService;
import ca.gc.cra.relay.application.pipeline.DrainReport;
import ca.gc.cra.relay.application.pipeline.PipelineStartupException;
import ca.gc.cra.relay.config.CollectorConfig;
import ca.gc.cra.relay.config.CollectorConfigLoader;
import ca.gc.cra.relay.config.CompositionRoot;
import ca.gc.cra.relay.config.ConfigException;
import ca.gc.cra.relay.config.EnvironmentSnapshot;
import ca.gc.cra.relay.config.PipelineGraph;
import ca.gc.cra.relay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code relay run}: loads the configuration, starts every pipeline and receiver, and blocks until a JVM shutdown
 * signal drains the collector.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: relay run config=PATH [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--verbose]";
  private static final String HELP_TEXT = """
      Relay collector

      Usage:
        relay run config=PATH [options]

      Options:
        config=PATH                    Collector YAML document (required)
        metricsExporter=otlp|none      Relay self-metrics exporter (default otlp)
        otelEndpoint=URL               OTLP endpoint for relay self-metrics
        otelResourceAttributes=K=V,... Extra resource attributes for relay self-metrics
        --verbose                      Enable DEBUG logging (overrides service.telemetry.logs.level)
        --help                         Show this message

      Runs until SIGTERM or SIGINT, then stops receivers and drains pipelines for up to
      service.shutdown.drain_timeout.
      """;

  private RunCli() {}

  /**
   * Executes the command.
   *
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for relay run");
    }

    if (input.command().isPresent()) {
      log.error("Unexpected argument '{}'; expected key=value", input.command().get());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path configPath;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      configPath = ConfigCliUtils.extractConfigPath(kv);
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (configPath == null) {
      log.error("config=PATH is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CollectorConfig config;
    try {
      config = CollectorConfigLoader.load(configPath, EnvironmentSnapshot.capture());
    } catch (IOException ex) {
      log.error("Cannot read configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (ConfigException ex) {
      log.error("Invalid configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (!input.verbose()) {
      config.service().logLevel().ifPresent(LoggingConfigurator::setRootLevel);
    }

    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    CollectorService service;
    try {
      CompositionRoot root = new CompositionRoot(metrics);
      PipelineGraph graph = root.resolve(config);
      service = root.build(graph, List.of(metrics));
    } catch (ConfigException ex) {
      log.error("Invalid configuration {}: {}", configPath, ex.getMessage());
      metrics.close();
      return ExitCode.CONFIG_ERROR;
    }

    try {
      service.start();
      service.registerShutdownHook();
      log.info("Relay running with configuration {}; send SIGTERM or SIGINT to stop", configPath);
      service.awaitTermination();
      List<DrainReport> reports = service.shutdown();
      long timedOut = reports.stream().filter(report -> !report.clean()).count();
      if (timedOut > 0) {
        log.warn("{} pipeline(s) did not drain within the configured timeout", timedOut);
      }
      return ExitCode.SUCCESS;
    } catch (PipelineStartupException ex) {
      log.error("Relay failed to start: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Relay failed to bind a receiver: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in relay", ex);
      service.shutdown();
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
